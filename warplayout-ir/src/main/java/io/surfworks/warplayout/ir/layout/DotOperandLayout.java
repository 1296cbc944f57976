package io.surfworks.warplayout.ir.layout;

import java.util.Objects;

/**
 * Layout of an operand fed straight into a matrix-multiply.
 *
 * @param opIdx  0 for the left operand, 1 for the right operand
 * @param parent the accumulator layout of the consuming matrix-multiply
 * @param kWidth elements along the reduction dimension held per thread
 */
public record DotOperandLayout(int opIdx, Layout parent, int kWidth) implements Layout {

    public DotOperandLayout {
        if (opIdx != 0 && opIdx != 1) {
            throw new IllegalArgumentException("opIdx must be 0 or 1, got " + opIdx);
        }
        Objects.requireNonNull(parent, "parent cannot be null");
    }

    @Override
    public LayoutFamily family() {
        return LayoutFamily.DOT_OPERAND;
    }

    @Override
    public String toMlirString() {
        return "#dot_op<{opIdx = " + opIdx + ", parent = " + parent.toMlirString()
                + ", kWidth = " + kWidth + "}>";
    }
}
