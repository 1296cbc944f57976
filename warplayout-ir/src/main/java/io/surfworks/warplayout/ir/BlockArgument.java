package io.surfworks.warplayout.ir;

/**
 * A value bound on entry to a block: a function parameter, a loop induction
 * variable or a loop-carried value.
 */
public final class BlockArgument extends Value {

    private final Block owner;
    private int argNumber;

    BlockArgument(Block owner, int argNumber, Type type) {
        super(type);
        this.owner = owner;
        this.argNumber = argNumber;
    }

    public Block getOwner() {
        return owner;
    }

    public int getArgNumber() {
        return argNumber;
    }

    void setArgNumber(int argNumber) {
        this.argNumber = argNumber;
    }

    @Override
    public Operation getDefiningOp() {
        return null;
    }

    @Override
    public Block getParentBlock() {
        return owner;
    }

    @Override
    public String toString() {
        return "arg#" + argNumber + " : " + getType().toMlirString();
    }
}
