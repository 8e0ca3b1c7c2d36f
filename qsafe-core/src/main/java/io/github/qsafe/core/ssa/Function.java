package io.github.qsafe.core.ssa;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ext.ExtHolder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function, a list of {@link BasicBlock basic blocks}. The first block is the entry.
 * <p>
 * Classical functions take no arguments; every input is a constant.
 */
public final class Function extends ExtHolder {
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<String, Integer> varNames = new HashMap<>();

    /**
     * Create a new variable with the given name.
     * <p>
     * Variables with the same name in the same function are told apart by their index.
     *
     * @param name The name.
     * @return The new variable.
     */
    public Var newVar(String name) {
        int index = varNames.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index);
    }

    /**
     * Creates a new basic block at the end of this function.
     *
     * @return The new basic block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock(blocks.size());
        bb.attachExt(CommonExts.OWNING_FUNCTION, this);
        blocks.add(bb);
        return bb;
    }

    /**
     * Get the blocks of this function, in creation order.
     *
     * @return The blocks.
     */
    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Get the entry block.
     *
     * @return The entry block.
     * @throws IllegalStateException If the function has no blocks.
     */
    public BasicBlock getEntry() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("function has no blocks");
        }
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
