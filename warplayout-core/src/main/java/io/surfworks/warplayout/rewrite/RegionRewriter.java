package io.surfworks.warplayout.rewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.warplayout.analysis.ValueLayoutMap;
import io.surfworks.warplayout.inference.CostModel;
import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.ir.Block;
import io.surfworks.warplayout.ir.BlockArgument;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.IfOp;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.OpOperand;
import io.surfworks.warplayout.ir.OpResult;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Region;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Type;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.WhileOp;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Rewrites a function so that every value takes the layout it resolved to.
 *
 * <p>Blocks are visited from the function body inwards. An operation with a
 * result whose resolved layout differs from its declared one is recreated in the
 * new layout and the original is deleted once the whole function is done.
 * Any other operation keeps its layouts, and its operands are converted back
 * to what it expects where the producer changed. Terminators are given the
 * layouts their parent expects.
 *
 * <p>Example usage:
 * <pre>{@code
 * ValueLayoutMap layouts = new LayoutPropagation(inference, costModel).analyze(function);
 * RegionRewriter rewriter = new RegionRewriter(layouts, inference, costModel);
 * rewriter.rewrite(function);
 * }</pre>
 *
 * <p>A rewriter is bound to one analysis result and must not be reused for another function.
 */
public final class RegionRewriter {

    private static final Logger LOG = Logger.getLogger(RegionRewriter.class.getName());

    private final ValueLayoutMap layouts;
    private final LayoutInference inference;
    private final CostModel costModel;
    private final RewriteMapping mapping = new RewriteMapping();
    private final Set<Operation> opsToDelete = new LinkedHashSet<>();
    private int conversionsInserted;
    private int opsRewritten;

    public RegionRewriter(ValueLayoutMap layouts, LayoutInference inference, CostModel costModel) {
        this.layouts = Objects.requireNonNull(layouts, "layouts cannot be null");
        this.inference = Objects.requireNonNull(inference, "inference cannot be null");
        this.costModel = Objects.requireNonNull(costModel, "costModel cannot be null");
    }

    public void rewrite(Function function) {
        Deque<Block> queue = new ArrayDeque<>();
        queue.push(function.getEntryBlock());
        while (!queue.isEmpty()) {
            Block block = queue.pop();
            for (Operation op : block.getOperations()) {
                if (needsRewrite(op)) {
                    Operation newOp = rewriteOp(op);
                    pushRegions(newOp, queue);
                } else if (op.is(Opcode.YIELD)) {
                    rewriteYield(op);
                } else if (op.is(Opcode.CONDITION)) {
                    rewriteCondition(op);
                } else if (isReduceToScalar(op)) {
                    rewriteReduceToScalar(op);
                } else {
                    for (OpOperand operand : op.getOpOperands()) {
                        Value value = operand.get();
                        if (layouts.contains(value)) {
                            operand.set(getValueAs(value, value.layout()));
                        }
                    }
                    pushRegions(op, queue);
                }
            }
        }
        List<Operation> doomed = new ArrayList<>(opsToDelete);
        for (int i = doomed.size() - 1; i >= 0; i--) {
            doomed.get(i).erase();
        }
        LOG.fine("Rewrote " + opsRewritten + " operations of @" + function.name()
                + ", inserted " + conversionsInserted + " conversions");
    }

    /**
     * Returns {@code value} as it exists after the rewrite, converted to {@code layout}
     * if needed. Asking twice for the same value and layout returns the same value.
     *
     * @throws AssertionError if the value resolved to a layout for which no replacement was created yet
     */
    public Value getValueAs(Value value, Layout layout) {
        TensorType type = value.tensorType();
        if (type == null) {
            return value;
        }
        Value rewritten = value;
        Layout picked = layouts.resolvedLayout(value);
        if (picked != null && !picked.equals(type.layout())) {
            rewritten = mapping.lookup(value, picked);
            if (rewritten == null) {
                throw new AssertionError("No replacement of " + value + " in " + picked.toMlirString());
            }
        }
        if (Objects.equals(rewritten.layout(), layout)) {
            return rewritten;
        }
        Value cached = mapping.cachedConversion(rewritten, layout);
        if (cached != null) {
            return cached;
        }
        IrBuilder builder = new IrBuilder();
        builder.setInsertionPointAfterValue(rewritten);
        Value converted = builder.convertLayout(rewritten, type.withLayout(layout));
        mapping.cacheConversion(rewritten, layout, converted);
        conversionsInserted++;
        return converted;
    }

    /**
     * Returns the number of conversions inserted so far.
     */
    public int conversionsInserted() {
        return conversionsInserted;
    }

    /**
     * Returns the number of operations recreated in a new layout so far.
     */
    public int opsRewritten() {
        return opsRewritten;
    }

    private boolean needsRewrite(Operation op) {
        for (OpResult result : op.getResults()) {
            Layout picked = layouts.resolvedLayout(result);
            if (picked != null && !picked.equals(result.layout())) {
                return true;
            }
        }
        return false;
    }

    private static void pushRegions(Operation op, Deque<Block> queue) {
        for (Region region : op.getRegions()) {
            queue.push(region.getBlock());
        }
    }

    private static boolean isReduceToScalar(Operation op) {
        return op.is(Opcode.REDUCE) && !op.getResult(0).isTensor();
    }

    // ==================== Terminators ====================

    private void rewriteYield(Operation yield) {
        Operation parent = yield.getParentOp();
        if (parent == null) {
            return;
        }
        for (int i = 0; i < yield.getNumOperands(); i++) {
            Type expected = yield.getOperand(i).getType();
            if (parent.is(Opcode.FOR) || parent.is(Opcode.IF)) {
                expected = parent.getResult(i).getType();
            } else if (parent.is(Opcode.WHILE)) {
                expected = WhileOp.wrap(parent).getBeforeArguments().get(i).getType();
            }
            if (expected instanceof TensorType tensor) {
                yield.setOperand(i, getValueAs(yield.getOperand(i), tensor.layout()));
            }
        }
    }

    private void rewriteCondition(Operation condition) {
        Operation whileOp = condition.getParentOp();
        for (int i = 1; i < condition.getNumOperands(); i++) {
            if (whileOp.getResult(i - 1).getType() instanceof TensorType tensor) {
                condition.setOperand(i, getValueAs(condition.getOperand(i), tensor.layout()));
            }
        }
    }

    /**
     * A reduction to a scalar may take its operand in any layout, so the operand
     * is given the first layout the analysis found for one of them.
     */
    private void rewriteReduceToScalar(Operation reduce) {
        Layout sourceLayout = null;
        for (Value operand : reduce.getOperands()) {
            Layout picked = layouts.resolvedLayout(operand);
            if (picked != null) {
                sourceLayout = picked;
                break;
            }
        }
        if (sourceLayout == null) {
            return;
        }
        for (int i = 0; i < reduce.getNumOperands(); i++) {
            reduce.setOperand(i, getValueAs(reduce.getOperand(i), sourceLayout));
        }
    }

    // ==================== Operations ====================

    private Operation rewriteOp(Operation op) {
        opsToDelete.add(op);
        opsRewritten++;
        switch (op.getOpcode()) {
            case FOR -> {
                return rewriteFor(op);
            }
            case WHILE -> {
                return rewriteWhile(op);
            }
            case IF -> {
                return rewriteIf(op);
            }
            default -> { }
        }
        IrBuilder builder = IrBuilder.before(op);
        Layout layout = layouts.resolvedLayout(op.getResult(0));
        TensorType resultType = op.getResult(0).tensorType();
        if (op.is(Opcode.CONVERT_LAYOUT)) {
            Value source = op.getOperand(0);
            Layout sourceLayout = layouts.contains(source) ? layouts.resolvedLayout(source) : source.layout();
            Value newSource = getValueAs(source, sourceLayout);
            builder.setInsertionPoint(op);
            Value converted = builder.convertLayout(newSource, resultType.withLayout(layout));
            mapping.map(op.getResult(0), converted);
            return converted.getDefiningOp();
        }
        if (costModel.canFoldConversionInto(op, layout)) {
            Operation copy = builder.clone(op);
            for (int i = 0; i < op.getNumOperands(); i++) {
                Value operand = op.getOperand(i);
                if (operand.isTensor()) {
                    copy.setOperand(i, getValueAs(operand, operand.layout()));
                }
            }
            builder.setInsertionPointAfter(copy);
            Value converted = builder.convertLayout(copy.getResult(0), resultType.withLayout(layout));
            mapping.map(op.getResult(0), converted);
            return converted.getDefiningOp();
        }
        if (propagatesLayout(op)) {
            return cloneInLayout(op, layout);
        }
        throw new AssertionError("Unexpected operation to rewrite: " + op.getOpcode());
    }

    private static boolean propagatesLayout(Operation op) {
        return switch (op.getCategory()) {
            case ELEMENTWISE, LAYOUT_PRESERVING, ATOMIC, REDUCTION, SHAPE, CONVERSION -> true;
            default -> false;
        };
    }

    private Operation cloneInLayout(Operation op, Layout layout) {
        IrBuilder builder = IrBuilder.before(op);
        Operation copy = builder.clone(op);
        if (op.getNumOperands() > 0) {
            Optional<Layout> operandLayout = inference.inferSourceLayout(op, layout);
            if (operandLayout.isEmpty()) {
                throw new AssertionError("No operand layout for " + op.getOpcode() + " producing " + layout.toMlirString());
            }
            for (int i = 0; i < op.getNumOperands(); i++) {
                copy.setOperand(i, getValueAs(op.getOperand(i), operandLayout.get()));
            }
        }
        for (int i = 0; i < op.getNumResults(); i++) {
            OpResult newResult = copy.getResult(i);
            if (newResult.getType() instanceof TensorType tensor) {
                newResult.setType(tensor.withLayout(layout));
            }
        }
        for (int i = 0; i < op.getNumResults(); i++) {
            OpResult oldResult = op.getResult(i);
            OpResult newResult = copy.getResult(i);
            if (layouts.contains(oldResult) || !newResult.isTensor()) {
                remap(oldResult, newResult);
            } else if (!oldResult.useEmpty()) {
                // Results the analysis never reached keep their old layout for their users.
                IrBuilder after = new IrBuilder();
                after.setInsertionPointAfter(copy);
                oldResult.replaceAllUsesWith(after.convertLayout(newResult, oldResult.tensorType()));
                conversionsInserted++;
            }
        }
        return copy;
    }

    private void remap(Value oldValue, Value newValue) {
        if (oldValue.getType().equals(newValue.getType())) {
            oldValue.replaceAllUsesWith(newValue);
        } else {
            mapping.map(oldValue, newValue);
        }
    }

    private Operation rewriteFor(Operation op) {
        ForOp oldFor = ForOp.wrap(op);
        List<Value> inits = new ArrayList<>();
        List<Value> oldInits = oldFor.getInitArgs();
        for (int i = 0; i < oldInits.size(); i++) {
            Layout picked = layouts.resolvedLayout(op.getResult(i));
            inits.add(picked != null ? getValueAs(oldInits.get(i), picked) : oldInits.get(i));
        }
        IrBuilder builder = IrBuilder.before(op);
        ForOp newFor = builder.forLoop(oldFor.getLowerBound(), oldFor.getUpperBound(), oldFor.getStep(), inits);
        newFor.getOperation().setAttributes(op.getAttributes());
        newFor.getBody().spliceFrom(oldFor.getBody());
        for (int i = 0; i < op.getNumResults(); i++) {
            remap(op.getResult(i), newFor.getOperation().getResult(i));
        }
        List<BlockArgument> oldArgs = oldFor.getBody().getArguments();
        for (int i = 0; i < oldArgs.size(); i++) {
            remap(oldArgs.get(i), newFor.getBody().getArgument(i));
        }
        return newFor.getOperation();
    }

    private Operation rewriteWhile(Operation op) {
        WhileOp oldWhile = WhileOp.wrap(op);
        List<Value> inits = new ArrayList<>();
        List<BlockArgument> beforeArgs = oldWhile.getBeforeArguments();
        for (int i = 0; i < op.getNumOperands(); i++) {
            Layout picked = layouts.resolvedLayout(beforeArgs.get(i));
            inits.add(picked != null ? getValueAs(op.getOperand(i), picked) : op.getOperand(i));
        }
        List<Type> resultTypes = new ArrayList<>();
        for (OpResult result : op.getResults()) {
            Layout picked = layouts.resolvedLayout(result);
            resultTypes.add(picked != null ? result.tensorType().withLayout(picked) : result.getType());
        }
        IrBuilder builder = IrBuilder.before(op);
        WhileOp newWhile = builder.whileLoop(resultTypes, inits);
        for (Value init : inits) {
            newWhile.getBefore().addArgument(init.getType());
        }
        for (Type type : resultTypes) {
            newWhile.getAfter().addArgument(type);
        }
        newWhile.getBefore().spliceFrom(oldWhile.getBefore());
        newWhile.getAfter().spliceFrom(oldWhile.getAfter());
        for (int i = 0; i < op.getNumResults(); i++) {
            remap(op.getResult(i), newWhile.getOperation().getResult(i));
        }
        for (int i = 0; i < beforeArgs.size(); i++) {
            remap(beforeArgs.get(i), newWhile.getBeforeArguments().get(i));
        }
        List<BlockArgument> afterArgs = oldWhile.getAfterArguments();
        for (int i = 0; i < afterArgs.size(); i++) {
            remap(afterArgs.get(i), newWhile.getAfterArguments().get(i));
        }
        return newWhile.getOperation();
    }

    private Operation rewriteIf(Operation op) {
        IfOp oldIf = IfOp.wrap(op);
        List<Type> resultTypes = new ArrayList<>();
        for (OpResult result : op.getResults()) {
            Layout picked = layouts.resolvedLayout(result);
            resultTypes.add(picked != null ? result.tensorType().withLayout(picked) : result.getType());
        }
        IrBuilder builder = IrBuilder.before(op);
        IfOp newIf = builder.ifThenElse(resultTypes, oldIf.getCondition());
        newIf.getOperation().getRegion(0).takeBody(op.getRegion(0));
        newIf.getOperation().getRegion(1).takeBody(op.getRegion(1));
        for (int i = 0; i < op.getNumResults(); i++) {
            remap(op.getResult(i), newIf.getOperation().getResult(i));
        }
        return newIf.getOperation();
    }
}
