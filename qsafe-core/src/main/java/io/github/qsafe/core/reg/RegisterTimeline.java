package io.github.qsafe.core.reg;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ssa.Var;

import java.util.HashMap;
import java.util.Map;

/**
 * When each register version of a straight-line function is produced, overwritten and last read.
 * <p>
 * Effects are indexed from 0, and the return is indexed after the last effect. A version is
 * read by the users of the node producing it in the dependency graph.
 */
public final class RegisterTimeline {
    /**
     * The index of an event that never happens.
     */
    public static final int NEVER = Integer.MAX_VALUE;

    private final Map<RegisterRef, Integer> producedAt = new HashMap<>();
    private final Map<RegisterRef, Integer> lastUse = new HashMap<>();

    /**
     * Compute the timeline from a dependency graph.
     *
     * @param dag The graph.
     * @return The timeline.
     */
    public static RegisterTimeline compute(DependencyDag dag) {
        RegisterTimeline timeline = new RegisterTimeline();
        for (DependencyDag.Node node : dag.getNodes()) {
            timeline.visit(node);
        }
        return timeline;
    }

    private void visit(DependencyDag.Node node) {
        int lastUser = -1;
        for (DependencyDag.Node user : node.getUsers()) {
            lastUser = Math.max(lastUser, user.index);
        }
        for (Var result : node.effect.getAssignsTo()) {
            RegisterRef ref = result.getExtOrThrow(CommonExts.REGISTER);
            producedAt.putIfAbsent(ref, node.index);
            // a version produced twice is read wherever either value is
            lastUse.merge(ref, lastUser, Math::max);
        }
    }

    /**
     * Get the index of the instruction producing a version.
     *
     * @param ref The version.
     * @return The index, or -1 if it is never produced.
     */
    public int producedAt(RegisterRef ref) {
        return producedAt.getOrDefault(ref, -1);
    }

    /**
     * Get the index of the instruction producing the next version of the same register.
     *
     * @param ref The version.
     * @return The index, or {@link #NEVER}.
     */
    public int nextOverwrite(RegisterRef ref) {
        return producedAt.getOrDefault(ref.next(), NEVER);
    }

    /**
     * Get the index of the last instruction reading a version.
     *
     * @param ref The version.
     * @return The index, or -1 if it is never read.
     */
    public int lastUse(RegisterRef ref) {
        return lastUse.getOrDefault(ref, -1);
    }

    /**
     * Whether reading a version at an index is valid.
     * <p>
     * The left operand of an in-place operation is consumed: that read is only valid at the
     * index producing the next version. Every other read must precede it.
     *
     * @param ref       The version read.
     * @param index     The index of the reading instruction.
     * @param consuming Whether the read consumes the version.
     * @return Whether the read is valid.
     */
    public boolean isValidRead(RegisterRef ref, int index, boolean consuming) {
        int produced = producedAt(ref);
        if (produced < 0 || produced >= index || index > lastUse(ref)) {
            return false;
        }
        int overwrite = nextOverwrite(ref);
        return consuming ? index == overwrite : index < overwrite;
    }
}
