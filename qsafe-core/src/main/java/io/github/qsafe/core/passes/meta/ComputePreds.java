package io.github.qsafe.core.passes.meta;

import io.github.qsafe.core.passes.IRPass;
import io.github.qsafe.core.ssa.BasicBlock;
import io.github.qsafe.core.ssa.Function;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the predecessors of each block, into a table the function does not hold.
 */
public class ComputePreds implements IRPass<Function, Map<BasicBlock, List<BasicBlock>>> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public Map<BasicBlock, List<BasicBlock>> run(Function func) {
        Map<BasicBlock, List<BasicBlock>> preds = new IdentityHashMap<>();
        for (BasicBlock block : func.getBlocks()) {
            preds.put(block, new ArrayList<>());
        }
        for (BasicBlock block : func.getBlocks()) {
            if (block.getControl() == null) {
                throw new IllegalStateException("block " + block.toTargetString() + " has no control instruction");
            }
            for (BasicBlock target : block.getControl().targets) {
                preds.get(target).add(block);
            }
        }
        return preds;
    }
}
