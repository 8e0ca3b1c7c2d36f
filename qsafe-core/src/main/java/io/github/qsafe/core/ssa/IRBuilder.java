package io.github.qsafe.core.ssa;

/**
 * Appends instructions to one block of a function at a time.
 * <p>
 * Classical programs are built block by block, switching blocks with {@link #setBlock(BasicBlock)};
 * quantum-safe code only ever has the one block.
 */
public class IRBuilder {
    /**
     * The function whose blocks are being built.
     */
    public final Function func;
    private BasicBlock bb;

    /**
     * Construct a builder appending to a block.
     *
     * @param func The function.
     * @param bb   The block, which must be one of the function's.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    /**
     * Get the block effects are being appended to.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Append to another block from now on.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Add a new, empty block to the function, without moving to it.
     *
     * @return The block.
     */
    public BasicBlock newBlock() {
        return func.newBb();
    }

    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Append an instruction assigning to an existing variable.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return The same variable.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Append an instruction assigning to a fresh variable.
     *
     * @param insn The instruction.
     * @param name The name of the variable, numbered if it is taken.
     * @return The variable.
     */
    public Var insert(Insn insn, String name) {
        return insert(insn, func.newVar(name));
    }

    /**
     * End the block with a control instruction.
     *
     * @param ctrl The control instruction.
     * @throws IllegalStateException If the block already ends in one.
     */
    public void insertCtrl(Control ctrl) {
        if (bb.getControl() != null) {
            throw new IllegalStateException("block " + bb.toTargetString()
                    + " already ends in " + bb.getControl());
        }
        bb.setControl(ctrl);
    }
}
