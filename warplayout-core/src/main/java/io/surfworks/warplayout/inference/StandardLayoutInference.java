package io.surfworks.warplayout.inference;

import java.util.Optional;

import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.layout.BlockedLayout;
import io.surfworks.warplayout.ir.layout.Layout;
import io.surfworks.warplayout.ir.layout.SliceLayout;

/**
 * Layout inference rules for the operations of the IR.
 *
 * <p>Elementwise and layout-preserving operations keep the layout. Reductions
 * slice the reduced axis away and {@code tt.expand_dims} puts it back.
 * {@code tt.join} and {@code tt.split} add and remove a thread-local trailing
 * dimension of size two on blocked layouts.
 */
public final class StandardLayoutInference implements LayoutInference {

    @Override
    public Optional<Layout> inferDestinationLayout(Operation op, Layout sourceLayout) {
        return switch (op.getOpcode()) {
            case REDUCE -> Optional.of(new SliceLayout(axisOf(op), sourceLayout));
            case EXPAND_DIMS -> sourceLayout instanceof SliceLayout slice && slice.dim() == axisOf(op)
                    ? Optional.of(slice.parent())
                    : Optional.empty();
            case JOIN -> sourceLayout instanceof BlockedLayout blocked
                    ? Optional.of(blocked.appendDim(2))
                    : Optional.empty();
            case SPLIT -> sourceLayout instanceof BlockedLayout blocked
                    ? Optional.ofNullable(blocked.dropLastDim(2))
                    : Optional.empty();
            case RESHAPE -> sameRank(op) ? Optional.of(sourceLayout) : Optional.empty();
            case CONVERT_LAYOUT -> {
                // Conversions into staging memory keep their target.
                Layout target = op.getResult(0).layout();
                yield target != null && target.isSharedMemory() ? Optional.empty() : Optional.of(sourceLayout);
            }
            default -> Optional.of(sourceLayout);
        };
    }

    @Override
    public Optional<Layout> inferSourceLayout(Operation op, Layout resultLayout) {
        switch (op.getCategory()) {
            case ELEMENTWISE, LAYOUT_PRESERVING, MEMORY, ATOMIC -> {
                return Optional.of(resultLayout);
            }
            default -> { }
        }
        return switch (op.getOpcode()) {
            case WHILE, YIELD, CONDITION -> Optional.of(resultLayout);
            case REDUCE -> resultLayout instanceof SliceLayout slice && slice.dim() == axisOf(op)
                    ? Optional.of(slice.parent())
                    : Optional.empty();
            case EXPAND_DIMS -> Optional.of(new SliceLayout(axisOf(op), resultLayout));
            case JOIN -> resultLayout instanceof BlockedLayout blocked
                    ? Optional.ofNullable(blocked.dropLastDim(2))
                    : Optional.empty();
            case SPLIT -> resultLayout instanceof BlockedLayout blocked
                    ? Optional.of(blocked.appendDim(2))
                    : Optional.empty();
            case RESHAPE -> sameRank(op) ? Optional.of(resultLayout) : Optional.empty();
            default -> Optional.empty();
        };
    }

    private static int axisOf(Operation op) {
        Number axis = op.attribute("axis");
        if (axis == null) {
            throw new IllegalArgumentException(op.getOpcode() + " has no axis attribute");
        }
        return axis.intValue();
    }

    private static boolean sameRank(Operation op) {
        TensorType in = op.getOperand(0).tensorType();
        TensorType out = op.getResult(0).tensorType();
        return in != null && out != null && in.rank() == out.rank();
    }
}
