package io.github.qsafe.core.circuit;

import org.apache.log4j.Logger;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

/**
 * Simulates a {@link QuantumCircuit} on a sparse state vector, storing only
 * the basis states with a non-negligible amplitude.
 * <p>
 * Arithmetic circuits on basis-state inputs only spread the state out within a
 * Fourier transform, so the number of stored states stays small.
 */
public class StateVectorSimulator {
    private static final Logger LOGGER = Logger.getLogger(StateVectorSimulator.class);
    /**
     * Basis states whose probability falls below this are dropped.
     */
    private static final double PRUNE_PROBABILITY = 1e-14;
    private static final double INV_SQRT2 = 1 / Math.sqrt(2);

    /**
     * Run a circuit from the all-zero state.
     *
     * @param circuit The circuit.
     * @return The final state.
     */
    public SimulationResult run(QuantumCircuit circuit) {
        Map<BitSet, double[]> state = new HashMap<>();
        state.put(new BitSet(), new double[]{1, 0});
        int peak = 1;
        for (Gate gate : circuit.getGates()) {
            state = apply(state, gate);
            peak = Math.max(peak, state.size());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("simulated " + circuit + ", peak of " + peak + " basis states");
        }
        return new SimulationResult(state);
    }

    private static Map<BitSet, double[]> apply(Map<BitSet, double[]> state, Gate gate) {
        switch (gate.kind) {
            case X:
            case MCX: {
                Map<BitSet, double[]> next = new HashMap<>();
                int target = gate.target(0);
                for (Map.Entry<BitSet, double[]> entry : state.entrySet()) {
                    BitSet basis = entry.getKey();
                    if (allSet(basis, gate.controls())) {
                        basis = (BitSet) basis.clone();
                        basis.flip(target);
                    }
                    next.put(basis, entry.getValue());
                }
                return next;
            }
            case SWAP: {
                Map<BitSet, double[]> next = new HashMap<>();
                int a = gate.target(0);
                int b = gate.target(1);
                for (Map.Entry<BitSet, double[]> entry : state.entrySet()) {
                    BitSet basis = entry.getKey();
                    if (basis.get(a) != basis.get(b)) {
                        basis = (BitSet) basis.clone();
                        basis.flip(a);
                        basis.flip(b);
                    }
                    next.put(basis, entry.getValue());
                }
                return next;
            }
            case PHASE: {
                double cos = Math.cos(gate.angle);
                double sin = Math.sin(gate.angle);
                int target = gate.target(0);
                for (Map.Entry<BitSet, double[]> entry : state.entrySet()) {
                    BitSet basis = entry.getKey();
                    if (basis.get(target) && allSet(basis, gate.controls())) {
                        double[] amp = entry.getValue();
                        double re = amp[0] * cos - amp[1] * sin;
                        double im = amp[0] * sin + amp[1] * cos;
                        amp[0] = re;
                        amp[1] = im;
                    }
                }
                return state;
            }
            case H: {
                Map<BitSet, double[]> next = new HashMap<>();
                int target = gate.target(0);
                for (Map.Entry<BitSet, double[]> entry : state.entrySet()) {
                    BitSet basis = entry.getKey();
                    double[] amp = entry.getValue();
                    double sign = basis.get(target) ? -1 : 1;
                    BitSet zero = (BitSet) basis.clone();
                    zero.clear(target);
                    BitSet one = (BitSet) basis.clone();
                    one.set(target);
                    accumulate(next, zero, amp[0] * INV_SQRT2, amp[1] * INV_SQRT2);
                    accumulate(next, one, sign * amp[0] * INV_SQRT2, sign * amp[1] * INV_SQRT2);
                }
                next.values().removeIf(amp -> amp[0] * amp[0] + amp[1] * amp[1] < PRUNE_PROBABILITY);
                return next;
            }
            default:
                throw new IllegalStateException("unknown gate " + gate);
        }
    }

    private static void accumulate(Map<BitSet, double[]> state, BitSet basis, double re, double im) {
        double[] amp = state.computeIfAbsent(basis, $ -> new double[2]);
        amp[0] += re;
        amp[1] += im;
    }

    private static boolean allSet(BitSet basis, int[] qubits) {
        for (int qubit : qubits) {
            if (!basis.get(qubit)) return false;
        }
        return true;
    }
}
