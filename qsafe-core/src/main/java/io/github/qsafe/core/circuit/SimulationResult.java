package io.github.qsafe.core.circuit;

import io.github.qsafe.core.util.TwosComplement;

import java.util.BitSet;
import java.util.Map;

/**
 * The final state of a simulated circuit.
 */
public final class SimulationResult {
    private final Map<BitSet, double[]> state;
    private final BitSet mostLikely;
    private final double mostLikelyProbability;

    SimulationResult(Map<BitSet, double[]> state) {
        this.state = state;
        BitSet best = new BitSet();
        double bestP = -1;
        for (Map.Entry<BitSet, double[]> entry : state.entrySet()) {
            double[] amp = entry.getValue();
            double p = amp[0] * amp[0] + amp[1] * amp[1];
            if (p > bestP) {
                bestP = p;
                best = entry.getKey();
            }
        }
        this.mostLikely = best;
        this.mostLikelyProbability = bestP;
    }

    /**
     * Measure a register in the most likely outcome of the whole circuit.
     *
     * @param reg The register.
     * @return Its bits, least significant first.
     */
    public boolean[] measure(QubitRegister reg) {
        boolean[] bits = new boolean[reg.width()];
        for (int i = 0; i < bits.length; i++) {
            bits[i] = mostLikely.get(reg.qubit(i));
        }
        return bits;
    }

    /**
     * Measure a register and decode it as a two's complement integer.
     *
     * @param reg The register.
     * @return The value.
     */
    public long measureSigned(QubitRegister reg) {
        return TwosComplement.decode(measure(reg));
    }

    /**
     * Measure a single-qubit boolean register.
     *
     * @param reg The register.
     * @return Whether the qubit is set.
     * @throws IllegalArgumentException If the register is wider than one qubit.
     */
    public boolean measureBoolean(QubitRegister reg) {
        if (reg.width() != 1) {
            throw new IllegalArgumentException("boolean register " + reg + " has width " + reg.width());
        }
        return mostLikely.get(reg.qubit(0));
    }

    public long measureUnsigned(QubitRegister reg) {
        return TwosComplement.decodeUnsigned(measure(reg));
    }

    /**
     * Get the probability of the most likely outcome, 1 for a basis state up to rounding.
     *
     * @return The probability.
     */
    public double getMostLikelyProbability() {
        return mostLikelyProbability;
    }

    public int getStateCount() {
        return state.size();
    }
}
