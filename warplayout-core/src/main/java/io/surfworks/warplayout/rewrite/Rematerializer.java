package io.surfworks.warplayout.rewrite;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

import io.surfworks.warplayout.analysis.BackwardSlice;
import io.surfworks.warplayout.inference.CostModel;
import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.DotOperandLayout;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Removes a conversion by recomputing its source chain directly in the target layout.
 *
 * <p>The chain is the conversion's {@link BackwardSlice}. Every operation in it
 * must be cheap to duplicate: no expensive memory access, no atomics, no matrix
 * multiply, no shared-memory staging and no region-holding operation other than
 * {@code scf.for}, whose iteration arguments are extended instead.
 *
 * <p>Conversions from or to shared memory, and conversions into a dot-operand
 * layout, are left alone.
 */
public final class Rematerializer {

    private static final Logger LOG = Logger.getLogger(Rematerializer.class.getName());

    private final LayoutInference inference;
    private final CostModel costModel;
    private final SliceRewriter sliceRewriter;

    public Rematerializer(LayoutInference inference, CostModel costModel) {
        this.inference = Objects.requireNonNull(inference, "inference cannot be null");
        this.costModel = Objects.requireNonNull(costModel, "costModel cannot be null");
        this.sliceRewriter = new SliceRewriter();
    }

    /**
     * Tries to remove {@code convert}.
     *
     * @return true if the conversion was removed
     */
    public boolean rematerialize(Operation convert) {
        Value source = convert.getOperand(0);
        Layout target = convert.getResult(0).layout();
        if (involvesSharedMemory(convert) || target instanceof DotOperandLayout) {
            return false;
        }
        Optional<BackwardSlice> slice = rematerializableSlice(source, target, null);
        if (slice.isEmpty()) {
            return false;
        }
        sliceRewriter.rewrite(slice.get(), convert);
        LOG.finer("Rematerialized " + slice.get().size() + " values into " + target.toMlirString());
        return true;
    }

    /**
     * Computes the backward slice of {@code root} in {@code layout} and checks that
     * every operation defining a value of it can be duplicated.
     *
     * @return the slice, or empty if it cannot be computed, is empty, or holds an
     *         operation that cannot be duplicated
     */
    public Optional<BackwardSlice> rematerializableSlice(Value root, Layout layout, Predicate<Operation> stop) {
        Optional<BackwardSlice> slice = BackwardSlice.compute(root, layout, inference, costModel, stop);
        if (slice.isEmpty() || slice.get().isEmpty()) {
            return Optional.empty();
        }
        for (Value v : slice.get().values()) {
            Operation def = v.getDefiningOp();
            if (def != null && !canBeRematerialized(def)) {
                LOG.finer("Cannot rematerialize " + def);
                return Optional.empty();
            }
        }
        return slice;
    }

    public boolean canBeRematerialized(Operation op) {
        return switch (op.getOpcode()) {
            case LOAD, STORE -> !costModel.isExpensiveMemoryOp(op);
            case CAT, ATOMIC_RMW, ATOMIC_CAS, DOT, ALLOC_TENSOR, INSERT_SLICE_ASYNC, EXTRACT_SLICE -> false;
            case IF, WHILE, CONDITION -> false;
            default -> true;
        };
    }

    static boolean involvesSharedMemory(Operation convert) {
        Layout target = convert.getResult(0).layout();
        Layout source = convert.getOperand(0).layout();
        return (target != null && target.isSharedMemory()) || (source != null && source.isSharedMemory());
    }
}
