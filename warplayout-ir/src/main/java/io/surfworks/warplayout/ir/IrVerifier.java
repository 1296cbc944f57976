package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Structural checker for the IR.
 *
 * Performs:
 * - Use-list integrity: every operand is registered in its value's use list
 * - Visibility: operands are defined before use, in the same block or an enclosing one
 * - Layout agreement on elementwise and layout-preserving operations
 * - Signature agreement of scf.for, scf.while, scf.if and their terminators
 * - Shape and element type agreement of layout conversions
 * - Accumulator and result agreement of tt.dot
 */
public final class IrVerifier {

    private final List<String> errors = new ArrayList<>();

    public IrVerifier() {}

    /**
     * Verifies a module and returns the problems found, empty if it is well formed.
     */
    public List<String> validate(Module module) {
        errors.clear();
        for (Function f : module.functions()) {
            verifyFunction(f);
        }
        return new ArrayList<>(errors);
    }

    public List<String> validate(Function function) {
        errors.clear();
        verifyFunction(function);
        return new ArrayList<>(errors);
    }

    /**
     * Verifies a module and throws if any problem is found.
     */
    public void check(Module module) {
        List<String> problems = validate(module);
        if (!problems.isEmpty()) {
            throw new IrVerificationException(problems);
        }
    }

    public void check(Function function) {
        List<String> problems = validate(function);
        if (!problems.isEmpty()) {
            throw new IrVerificationException(problems);
        }
    }

    private void verifyFunction(Function f) {
        Set<Value> visible = Collections.newSetFromMap(new IdentityHashMap<>());
        verifyBlock(f.getEntryBlock(), visible, "@" + f.name());
    }

    private void verifyBlock(Block block, Set<Value> enclosing, String where) {
        Set<Value> visible = Collections.newSetFromMap(new IdentityHashMap<>());
        visible.addAll(enclosing);
        visible.addAll(block.getArguments());
        List<Operation> ops = block.getOperations();
        for (int i = 0; i < ops.size(); i++) {
            Operation op = ops.get(i);
            String at = where + "/" + op.getOpcode().mnemonic() + "#" + i;
            if (op.isErased()) {
                error("%s: erased operation still in its block", at);
            }
            if (op.getOpcode().isTerminator() && i != ops.size() - 1) {
                error("%s: terminator is not the last operation of its block", at);
            }
            verifyOperands(op, visible, at);
            verifyOperation(op, at);
            for (int r = 0; r < op.getNumRegions(); r++) {
                verifyBlock(op.getRegion(r).getBlock(), visible, at + "/region" + r);
            }
            visible.addAll(op.getResults());
        }
    }

    private void verifyOperands(Operation op, Set<Value> visible, String at) {
        for (OpOperand operand : op.getOpOperands()) {
            Value v = operand.get();
            if (v == null) {
                error("%s: operand #%d was dropped", at, operand.getOperandNumber());
                continue;
            }
            if (!v.hasUse(operand)) {
                error("%s: operand #%d is missing from its value's use list", at, operand.getOperandNumber());
            }
            Operation def = v.getDefiningOp();
            if (def != null && def.isErased()) {
                error("%s: operand #%d uses a result of an erased %s", at, operand.getOperandNumber(), def.getOpcode());
            } else if (!visible.contains(v)) {
                error("%s: operand #%d (%s) is not defined before its use", at, operand.getOperandNumber(), v);
            }
        }
    }

    private void verifyOperation(Operation op, String at) {
        switch (op.getCategory()) {
            case ELEMENTWISE, LAYOUT_PRESERVING -> verifyLayoutAgreement(op, at);
            case CONVERSION -> verifyConversion(op, at);
            case MATMUL -> verifyDot(op, at);
            case CONTROL_FLOW -> {
                switch (op.getOpcode()) {
                    case FOR -> verifyFor(ForOp.wrap(op), at);
                    case WHILE -> verifyWhile(WhileOp.wrap(op), at);
                    case IF -> verifyIf(IfOp.wrap(op), at);
                    default -> { }
                }
            }
            default -> { }
        }
    }

    private void verifyLayoutAgreement(Operation op, String at) {
        Layout expected = null;
        List<Value> values = new ArrayList<>(op.getOperands());
        values.addAll(op.getResults());
        for (Value v : values) {
            if (v == null || !v.isTensor()) {
                continue;
            }
            if (expected == null) {
                expected = v.layout();
            } else if (!expected.equals(v.layout())) {
                error("%s: layout mismatch, %s vs %s", at, expected.toMlirString(), v.layout().toMlirString());
                return;
            }
        }
    }

    private void verifyConversion(Operation op, String at) {
        if (op.getNumOperands() != 1 || op.getNumResults() != 1) {
            error("%s: conversion must have one operand and one result", at);
            return;
        }
        TensorType src = op.getOperand(0) == null ? null : op.getOperand(0).tensorType();
        TensorType dst = op.getResult(0).tensorType();
        if (src == null || dst == null) {
            error("%s: conversion operands must be tensors", at);
        } else if (!src.sameShapeAndElement(dst)) {
            error("%s: conversion changes shape or element type: %s -> %s", at, src.toMlirString(), dst.toMlirString());
        }
    }

    private void verifyDot(Operation op, String at) {
        if (op.getNumOperands() != 3 || op.getNumResults() != 1) {
            error("%s: tt.dot must have three operands and one result", at);
            return;
        }
        Value acc = op.getOperand(2);
        if (acc != null && !acc.getType().equals(op.getResult(0).getType())) {
            error("%s: accumulator type %s differs from result type %s",
                    at, acc.getType().toMlirString(), op.getResult(0).getType().toMlirString());
        }
    }

    private void verifyFor(ForOp forOp, String at) {
        Operation op = forOp.getOperation();
        int n = forOp.getNumIterArgs();
        if (op.getNumResults() != n) {
            error("%s: %d inits but %d results", at, n, op.getNumResults());
            return;
        }
        Block body = forOp.getBody();
        if (body.getNumArguments() != n + ForOp.NUM_INDUCTION_VARS) {
            error("%s: %d inits but %d body arguments", at, n, body.getNumArguments());
            return;
        }
        Operation yield = forOp.getYield();
        if (yield == null || !yield.is(Opcode.YIELD)) {
            error("%s: body does not end with scf.yield", at);
            return;
        }
        if (yield.getNumOperands() != n) {
            error("%s: %d iteration arguments but yield has %d operands", at, n, yield.getNumOperands());
            return;
        }
        for (int i = 0; i < n; i++) {
            Type init = typeOf(forOp.getInitArgs().get(i));
            Type arg = forOp.getRegionIterArg(i).getType();
            Type result = op.getResult(i).getType();
            Type yielded = typeOf(yield.getOperand(i));
            if (!Objects.equals(init, arg) || !Objects.equals(arg, result) || !Objects.equals(result, yielded)) {
                error("%s: iteration argument #%d types disagree (init %s, arg %s, result %s, yield %s)",
                        at, i, render(init), render(arg), render(result), render(yielded));
            }
        }
    }

    private void verifyWhile(WhileOp whileOp, String at) {
        Operation op = whileOp.getOperation();
        List<Value> inits = whileOp.getInits();
        List<BlockArgument> beforeArgs = whileOp.getBeforeArguments();
        if (inits.size() != beforeArgs.size()) {
            error("%s: %d inits but %d before-region arguments", at, inits.size(), beforeArgs.size());
            return;
        }
        for (int i = 0; i < inits.size(); i++) {
            if (!Objects.equals(typeOf(inits.get(i)), beforeArgs.get(i).getType())) {
                error("%s: init #%d type differs from before-region argument", at, i);
            }
        }
        Operation condition = whileOp.getConditionOp();
        if (condition == null || !condition.is(Opcode.CONDITION)) {
            error("%s: before region does not end with scf.condition", at);
            return;
        }
        List<BlockArgument> afterArgs = whileOp.getAfterArguments();
        int forwarded = condition.getNumOperands() - 1;
        if (forwarded != op.getNumResults() || forwarded != afterArgs.size()) {
            error("%s: condition forwards %d values for %d results and %d after-region arguments",
                    at, forwarded, op.getNumResults(), afterArgs.size());
            return;
        }
        for (int i = 0; i < forwarded; i++) {
            Type forwardedType = typeOf(condition.getOperand(i + 1));
            if (!Objects.equals(forwardedType, afterArgs.get(i).getType())
                    || !Objects.equals(forwardedType, op.getResult(i).getType())) {
                error("%s: condition value #%d type disagrees with after-region argument or result", at, i);
            }
        }
        Operation yield = whileOp.getYieldOp();
        if (yield == null || !yield.is(Opcode.YIELD)) {
            error("%s: after region does not end with scf.yield", at);
            return;
        }
        if (yield.getNumOperands() != beforeArgs.size()) {
            error("%s: yield has %d operands for %d before-region arguments", at, yield.getNumOperands(), beforeArgs.size());
            return;
        }
        for (int i = 0; i < beforeArgs.size(); i++) {
            if (!Objects.equals(typeOf(yield.getOperand(i)), beforeArgs.get(i).getType())) {
                error("%s: yield operand #%d type differs from before-region argument", at, i);
            }
        }
    }

    private void verifyIf(IfOp ifOp, String at) {
        Operation op = ifOp.getOperation();
        verifyIfBranch(op, ifOp.getThenBlock(), at + "/then");
        if (ifOp.hasElse()) {
            verifyIfBranch(op, ifOp.getElseBlock(), at + "/else");
        } else if (op.getNumResults() > 0) {
            error("%s: scf.if with results must have an else region", at);
        }
    }

    private void verifyIfBranch(Operation op, Block branch, String at) {
        Operation yield = branch.getTerminator();
        if (yield == null || !yield.is(Opcode.YIELD)) {
            if (op.getNumResults() > 0) {
                error("%s: branch does not end with scf.yield", at);
            }
            return;
        }
        if (yield.getNumOperands() != op.getNumResults()) {
            error("%s: yield has %d operands for %d results", at, yield.getNumOperands(), op.getNumResults());
            return;
        }
        for (int i = 0; i < op.getNumResults(); i++) {
            if (!Objects.equals(typeOf(yield.getOperand(i)), op.getResult(i).getType())) {
                error("%s: yield operand #%d type differs from result", at, i);
            }
        }
    }

    private static Type typeOf(Value v) {
        return v == null ? null : v.getType();
    }

    private static String render(Type t) {
        return t == null ? "<none>" : t.toMlirString();
    }

    private void error(String format, Object... args) {
        errors.add(String.format(format, args));
    }
}
