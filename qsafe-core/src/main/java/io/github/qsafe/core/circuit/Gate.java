package io.github.qsafe.core.circuit;

import java.util.Arrays;

/**
 * A gate of a {@link QuantumCircuit}.
 */
public final class Gate {
    public enum Kind {
        /**
         * Pauli X on the target.
         */
        X,
        /**
         * Hadamard on the target.
         */
        H,
        /**
         * Phase rotation by the angle on the target, if every control is set.
         */
        PHASE,
        /**
         * X on the target, if every control is set.
         */
        MCX,
        /**
         * Exchange of the two targets.
         */
        SWAP,
    }

    public final Kind kind;
    private final int[] controls;
    private final int[] targets;
    public final double angle;

    Gate(Kind kind, int[] controls, int[] targets, double angle) {
        this.kind = kind;
        this.controls = controls;
        this.targets = targets;
        this.angle = angle;
    }

    public int[] getControls() {
        return controls.clone();
    }

    public int[] getTargets() {
        return targets.clone();
    }

    int[] controls() {
        return controls;
    }

    int target(int i) {
        return targets[i];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase());
        if (kind == Kind.PHASE) {
            sb.append('(').append(angle).append(')');
        }
        if (controls.length > 0) {
            sb.append(" c").append(Arrays.toString(controls));
        }
        sb.append(' ').append(Arrays.toString(targets));
        return sb.toString();
    }
}
