package io.github.qsafe.core.ops;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ssa.BasicBlock;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A collection of {@link Op}s and {@link OpKey}s that exist in both classical and quantum-safe IR.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: returns from the function, with zero or one argument.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();

    /**
     * Effect: returns the argument corresponding to its predecessor.
     * <p>
     * Must precede any other (non-phi) effect instructions within its basic block.
     */
    public static final UnaryOpKey<List<BasicBlock>> PHI = new UnaryOpKey<>("phi", bbs ->
            bbs.stream().map(BasicBlock::toTargetString).collect(Collectors.joining(" ")));

    static {
        PHI.attachExt(CommonExts.IS_PURE, true);
    }
}
