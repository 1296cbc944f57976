package io.surfworks.warplayout.ir;

/**
 * View of an {@code scf.if} operation: a condition operand, a then region and
 * an else region whose yields are tied to the results.
 */
public final class IfOp {

    private final Operation op;

    private IfOp(Operation op) {
        this.op = op;
    }

    public static IfOp wrap(Operation op) {
        if (op == null || !op.is(Opcode.IF)) {
            throw new IllegalArgumentException("Expected scf.if but got " + (op == null ? "null" : op.getOpcode()));
        }
        return new IfOp(op);
    }

    public static boolean isa(Operation op) {
        return op != null && op.is(Opcode.IF);
    }

    public Operation getOperation() {
        return op;
    }

    public Value getCondition() {
        return op.getOperand(0);
    }

    public Block getThenBlock() {
        return op.getRegion(0).getBlock();
    }

    public Block getElseBlock() {
        return op.getRegion(1).getBlock();
    }

    public boolean hasElse() {
        return !getElseBlock().isEmpty();
    }
}
