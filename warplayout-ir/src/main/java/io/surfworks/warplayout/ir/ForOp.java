package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * View of an {@code scf.for} operation.
 *
 * <p>Operands are {@code lowerBound, upperBound, step, inits...}. The body block
 * arguments are {@code inductionVar, iterArgs...}. Result {@code i}, iteration
 * argument {@code i}, init {@code i} and yield operand {@code i} are tied.
 */
public final class ForOp {

    public static final int NUM_CONTROL_OPERANDS = 3;
    public static final int NUM_INDUCTION_VARS = 1;

    private final Operation op;

    private ForOp(Operation op) {
        this.op = op;
    }

    public static ForOp wrap(Operation op) {
        if (op == null || !op.is(Opcode.FOR)) {
            throw new IllegalArgumentException("Expected scf.for but got " + (op == null ? "null" : op.getOpcode()));
        }
        return new ForOp(op);
    }

    public static boolean isa(Operation op) {
        return op != null && op.is(Opcode.FOR);
    }

    public Operation getOperation() {
        return op;
    }

    public Value getLowerBound() {
        return op.getOperand(0);
    }

    public Value getUpperBound() {
        return op.getOperand(1);
    }

    public Value getStep() {
        return op.getOperand(2);
    }

    public int getNumIterArgs() {
        return op.getNumOperands() - NUM_CONTROL_OPERANDS;
    }

    public List<Value> getInitArgs() {
        List<Value> operands = op.getOperands();
        return operands.subList(NUM_CONTROL_OPERANDS, operands.size());
    }

    public Block getBody() {
        return op.getRegion(0).getBlock();
    }

    public BlockArgument getInductionVar() {
        return getBody().getArgument(0);
    }

    public List<BlockArgument> getRegionIterArgs() {
        List<BlockArgument> args = getBody().getArguments();
        return args.subList(NUM_INDUCTION_VARS, args.size());
    }

    public BlockArgument getRegionIterArg(int index) {
        return getBody().getArgument(index + NUM_INDUCTION_VARS);
    }

    public Operation getYield() {
        return getBody().getTerminator();
    }

    /**
     * Returns true if the operand is one of the loop-carried inits (not a bound or step).
     */
    public boolean isInitOperand(OpOperand use) {
        return use.getOwner() == op && use.getOperandNumber() >= NUM_CONTROL_OPERANDS;
    }

    public BlockArgument getTiedLoopRegionIterArg(OpOperand init) {
        return getRegionIterArg(init.getOperandNumber() - NUM_CONTROL_OPERANDS);
    }

    public OpResult getTiedLoopResult(OpOperand init) {
        return op.getResult(init.getOperandNumber() - NUM_CONTROL_OPERANDS);
    }

    /**
     * Returns the init operand tied to an iteration argument.
     */
    public OpOperand getTiedLoopInit(BlockArgument iterArg) {
        return op.getOpOperand(iterArg.getArgNumber() - NUM_INDUCTION_VARS + NUM_CONTROL_OPERANDS);
    }

    /**
     * Returns the yield operand tied to an iteration argument.
     */
    public Value getTiedYieldedValue(BlockArgument iterArg) {
        return getYield().getOperand(iterArg.getArgNumber() - NUM_INDUCTION_VARS);
    }

    /**
     * Replaces this loop with a new one carrying additional iteration arguments.
     *
     * <p>The body block moves to the new loop as is, so its existing arguments
     * keep their identity; one argument per new operand is appended to it. Uses
     * of the old results are redirected to the matching new results. The yield is
     * left untouched: the caller must extend it. The old loop stays in place,
     * empty and unused, for the caller to erase.
     *
     * @return the new loop
     */
    public ForOp replaceWithNewSignature(IrBuilder builder, List<Value> newIterOperands) {
        builder.setInsertionPoint(op);
        List<Value> operands = new ArrayList<>(op.getOperands());
        operands.addAll(newIterOperands);
        Operation newOp = builder.create(Opcode.FOR, operands,
                typesOf(operands.subList(NUM_CONTROL_OPERANDS, operands.size())), op.getAttributes(), 1);
        newOp.getRegion(0).takeBody(op.getRegion(0));
        ForOp newFor = new ForOp(newOp);
        for (Value v : newIterOperands) {
            newFor.getBody().addArgument(v.getType());
        }
        for (OpResult result : op.getResults()) {
            result.replaceAllUsesWith(newOp.getResult(result.getResultNumber()));
        }
        return newFor;
    }

    static List<Type> typesOf(List<Value> values) {
        List<Type> types = new ArrayList<>(values.size());
        for (Value v : values) {
            types.add(v.getType());
        }
        return types;
    }
}
