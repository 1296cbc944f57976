package io.surfworks.warplayout.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Logger;

import io.surfworks.warplayout.inference.CostModel;
import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.ir.BlockArgument;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.OpResult;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * The values that would have to be recomputed for a conversion's source to come
 * out directly in the conversion's target layout, each with the layout it would
 * take.
 *
 * <p>Values keep the order they were reached in, starting with the root.
 *
 * <p>Example usage:
 * <pre>{@code
 * Optional<BackwardSlice> slice = BackwardSlice.compute(
 *     convert.getOperand(0), convert.getResult(0).layout(), inference, costModel, null);
 * slice.ifPresent(s -> System.out.println(s.size() + " values to rewrite"));
 * }</pre>
 */
public final class BackwardSlice {

    private static final Logger LOG = Logger.getLogger(BackwardSlice.class.getName());

    private final List<Value> values = new ArrayList<>();
    private final Set<Value> members = new HashSet<>();
    private final Map<Value, Layout> layouts = new HashMap<>();

    /**
     * Walks backwards from {@code root}, which should take {@code layout}.
     *
     * <p>The walk does not descend into an operation that can absorb a
     * conversion directly, nor into one matched by {@code stop}. It fails when a
     * value would need two different layouts, when it reaches a loop result, a
     * concatenation or a block argument other than a loop-carried one, or when
     * no operand layout can be inferred for an operation.
     *
     * @param stop operations to stop at, or null
     * @return the slice, or empty if the walk failed
     */
    public static Optional<BackwardSlice> compute(Value root, Layout layout, LayoutInference inference,
                                                  CostModel costModel, Predicate<Operation> stop) {
        BackwardSlice slice = new BackwardSlice();
        Deque<Value> queue = new ArrayDeque<>();
        Deque<Layout> queueLayouts = new ArrayDeque<>();
        queue.push(root);
        queueLayouts.push(layout);
        while (!queue.isEmpty()) {
            Value current = queue.pop();
            Layout encoding = queueLayouts.pop();
            if (!current.isTensor()) {
                continue;
            }
            if (current instanceof OpResult result && result.getOwner().is(Opcode.FOR)) {
                return fail("reached the result of a loop: " + current);
            }
            slice.addValue(current);
            Layout existing = slice.layouts.get(current);
            if (existing != null && !existing.equals(encoding)) {
                return fail("conflicting layouts for " + current);
            }
            slice.layouts.put(current, encoding);

            Operation def = current.getDefiningOp();
            if (def != null) {
                if (costModel.canFoldConversionInto(def, encoding)) {
                    continue;
                }
                if (stop != null && stop.test(def)) {
                    continue;
                }
                if (def.is(Opcode.CAT)) {
                    return fail("reached a concatenation: " + def);
                }
                for (Value operand : def.getOperands()) {
                    Optional<Layout> operandLayout = inference.inferSourceLayout(def, encoding);
                    if (operandLayout.isEmpty()) {
                        return fail("no operand layout for " + def + " producing " + encoding.toMlirString());
                    }
                    if (!slice.contains(operand)) {
                        queue.push(operand);
                        queueLayouts.push(operandLayout.get());
                    }
                }
                continue;
            }
            BlockArgument arg = (BlockArgument) current;
            Operation parent = arg.getOwner().getParentOp();
            if (parent != null && parent.is(Opcode.FOR) && arg.getArgNumber() >= ForOp.NUM_INDUCTION_VARS) {
                ForOp forOp = ForOp.wrap(parent);
                queue.push(forOp.getTiedLoopInit(arg).get());
                queueLayouts.push(encoding);
                queue.push(forOp.getTiedYieldedValue(arg));
                queueLayouts.push(encoding);
                continue;
            }
            return fail("reached a block argument that is not loop-carried: " + current);
        }
        return Optional.of(slice);
    }

    private static Optional<BackwardSlice> fail(String reason) {
        LOG.finer("Backward slice failed, " + reason);
        return Optional.empty();
    }

    private void addValue(Value value) {
        if (members.add(value)) {
            values.add(value);
        }
    }

    /**
     * Adds a value with its layout. The layout of a value already present is kept.
     */
    public void add(Value value, Layout layout) {
        addValue(value);
        layouts.putIfAbsent(value, layout);
    }

    /**
     * Merges another slice into this one. Layouts already recorded here win.
     */
    public void addAll(BackwardSlice other) {
        for (Value v : other.values) {
            add(v, other.layouts.get(v));
        }
    }

    public void remove(Value value) {
        if (members.remove(value)) {
            values.remove(value);
        }
    }

    public boolean contains(Value value) {
        return members.contains(value);
    }

    /**
     * Returns the layout recorded for a value, or null if there is none.
     */
    public Layout layoutOf(Value value) {
        return layouts.get(value);
    }

    /**
     * Returns a snapshot of the values in the order they were reached.
     */
    public List<Value> values() {
        return List.copyOf(values);
    }

    public Value get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "BackwardSlice[values=" + values.size() + "]";
    }
}
