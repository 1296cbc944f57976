package io.surfworks.warplayout.ir;

import java.util.List;

/**
 * View of an {@code scf.while} operation.
 *
 * <p>Operand {@code i} is tied to "before" argument {@code i}. The "before"
 * region ends in {@code scf.condition(cond, values...)} whose value {@code i}
 * is tied to "after" argument {@code i} and to result {@code i}. The "after"
 * region yields back into the "before" arguments.
 */
public final class WhileOp {

    private final Operation op;

    private WhileOp(Operation op) {
        this.op = op;
    }

    public static WhileOp wrap(Operation op) {
        if (op == null || !op.is(Opcode.WHILE)) {
            throw new IllegalArgumentException("Expected scf.while but got " + (op == null ? "null" : op.getOpcode()));
        }
        return new WhileOp(op);
    }

    public static boolean isa(Operation op) {
        return op != null && op.is(Opcode.WHILE);
    }

    public Operation getOperation() {
        return op;
    }

    public List<Value> getInits() {
        return op.getOperands();
    }

    public Block getBefore() {
        return op.getRegion(0).getBlock();
    }

    public Block getAfter() {
        return op.getRegion(1).getBlock();
    }

    public List<BlockArgument> getBeforeArguments() {
        return getBefore().getArguments();
    }

    public List<BlockArgument> getAfterArguments() {
        return getAfter().getArguments();
    }

    public Operation getConditionOp() {
        return getBefore().getTerminator();
    }

    public Operation getYieldOp() {
        return getAfter().getTerminator();
    }
}
