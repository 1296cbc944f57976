package io.surfworks.warplayout.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Ranked tensor type carrying its layout: {@code tensor<128x64xf32, #blocked<...>>}.
 *
 * <p>The layout is part of the type, so changing the layout of a value means
 * changing its type.
 */
public record TensorType(List<Integer> shape, Type elementType, Layout layout) implements Type {

    public TensorType {
        shape = List.copyOf(shape);
        Objects.requireNonNull(elementType, "elementType cannot be null");
        Objects.requireNonNull(layout, "layout cannot be null");
        if (elementType instanceof TensorType) {
            throw new IllegalArgumentException("Tensor of tensors is not supported");
        }
    }

    public TensorType withLayout(Layout newLayout) {
        return new TensorType(shape, elementType, newLayout);
    }

    public TensorType withElementType(Type newElementType) {
        return new TensorType(shape, newElementType, layout);
    }

    public int rank() {
        return shape.size();
    }

    public long numElements() {
        long count = 1;
        for (int d : shape) {
            count *= d;
        }
        return count;
    }

    /**
     * Returns true if the other type has the same shape and element type, ignoring layouts.
     */
    public boolean sameShapeAndElement(TensorType other) {
        return shape.equals(other.shape) && elementType.equals(other.elementType);
    }

    @Override
    public String toMlirString() {
        StringBuilder sb = new StringBuilder("tensor<");
        for (int d : shape) {
            sb.append(d).append("x");
        }
        sb.append(elementType.toMlirString());
        sb.append(", ").append(layout.toMlirString()).append(">");
        return sb.toString();
    }
}
