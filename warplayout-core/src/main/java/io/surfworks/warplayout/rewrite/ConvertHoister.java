package io.surfworks.warplayout.rewrite;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

import io.surfworks.warplayout.analysis.BackwardSlice;
import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.IrMapping;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.DotOperandLayout;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Moves a conversion above a widening cast or broadcast so that it converts the
 * narrower, or smaller, tensor.
 *
 * <p>The backward slice stops at casts, broadcasts and {@code tt.expand_dims}.
 * A stopping operation whose own operand chain can be recomputed joins the
 * slice. If exactly one does not, the conversion is recreated on that
 * operation's operand and the rest of the slice is recomputed on top of it.
 */
public final class ConvertHoister {

    private static final Logger LOG = Logger.getLogger(ConvertHoister.class.getName());

    private static final Predicate<Operation> EXT_OR_BROADCAST = op -> switch (op.getOpcode()) {
        case EXTSI, EXTUI, EXTF, BROADCAST, EXPAND_DIMS -> true;
        default -> false;
    };

    private final LayoutInference inference;
    private final Rematerializer rematerializer;
    private final SliceRewriter sliceRewriter = new SliceRewriter();

    public ConvertHoister(LayoutInference inference, Rematerializer rematerializer) {
        this.inference = Objects.requireNonNull(inference, "inference cannot be null");
        this.rematerializer = Objects.requireNonNull(rematerializer, "rematerializer cannot be null");
    }

    /**
     * Tries to hoist {@code convert}.
     *
     * @return true if the conversion was replaced by one placed before a cast or broadcast
     */
    public boolean hoist(Operation convert) {
        Layout target = convert.getResult(0).layout();
        if (Rematerializer.involvesSharedMemory(convert) || target instanceof DotOperandLayout) {
            return false;
        }
        Optional<BackwardSlice> found = rematerializer.rematerializableSlice(
                convert.getOperand(0), target, EXT_OR_BROADCAST);
        if (found.isEmpty()) {
            return false;
        }
        BackwardSlice slice = found.get();

        Operation blocker = null;
        int sliceSize = slice.size();
        for (int i = 0; i < sliceSize; i++) {
            Value v = slice.get(i);
            Operation op = v.getDefiningOp();
            if (op == null || !EXT_OR_BROADCAST.test(op)) {
                continue;
            }
            Optional<Layout> operandLayout = inference.inferSourceLayout(op, slice.layoutOf(v));
            if (operandLayout.isEmpty()) {
                return false;
            }
            Optional<BackwardSlice> operandSlice =
                    rematerializer.rematerializableSlice(op.getOperand(0), operandLayout.get(), null);
            if (operandSlice.isPresent()) {
                slice.addAll(operandSlice.get());
                continue;
            }
            if (blocker != null) {
                LOG.finer("Not hoisting above two casts or broadcasts");
                return false;
            }
            blocker = op;
        }
        if (blocker == null) {
            return false;
        }

        Value blockerResult = blocker.getResult(0);
        Layout resultLayout = slice.layoutOf(blockerResult);
        Optional<Layout> operandLayout = inference.inferSourceLayout(blocker, resultLayout);
        if (operandLayout.isEmpty()) {
            return false;
        }
        IrBuilder builder = IrBuilder.before(blocker);
        Value operand = blocker.getOperand(0);
        Value hoisted = builder.convertLayout(operand, operand.tensorType().withLayout(operandLayout.get()));
        Operation copy = builder.clone(blocker);
        copy.setOperand(0, hoisted);
        TensorType resultType = blockerResult.tensorType();
        copy.getResult(0).setType(resultType.withLayout(resultLayout));

        IrMapping mapping = new IrMapping();
        mapping.map(blockerResult, copy.getResult(0));
        slice.remove(blockerResult);
        sliceRewriter.rewrite(slice, convert, mapping);
        LOG.finer("Hoisted a conversion above " + blocker.getOpcode() + " into " + operandLayout.get().toMlirString());
        return true;
    }
}
