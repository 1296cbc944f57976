package io.surfworks.warplayout.ir;

/**
 * A value produced by an operation.
 */
public final class OpResult extends Value {

    private final Operation owner;
    private final int resultNumber;

    OpResult(Operation owner, int resultNumber, Type type) {
        super(type);
        this.owner = owner;
        this.resultNumber = resultNumber;
    }

    public Operation getOwner() {
        return owner;
    }

    public int getResultNumber() {
        return resultNumber;
    }

    @Override
    public Operation getDefiningOp() {
        return owner;
    }

    @Override
    public Block getParentBlock() {
        return owner.getBlock();
    }

    @Override
    public String toString() {
        return owner.getOpcode().mnemonic() + "#" + resultNumber + " : " + getType().toMlirString();
    }
}
