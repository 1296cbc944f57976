package io.surfworks.warplayout.ir;

import java.util.Objects;

/**
 * Pointer to a scalar ({@code !tt.ptr<f32>}) or to a whole tensor (a block pointer).
 */
public record PointerType(Type pointee) implements Type {

    public PointerType {
        Objects.requireNonNull(pointee, "pointee cannot be null");
        if (pointee instanceof PointerType) {
            throw new IllegalArgumentException("Pointer to pointer is not supported");
        }
    }

    public boolean isBlockPointer() {
        return pointee instanceof TensorType;
    }

    @Override
    public String toMlirString() {
        return "!tt.ptr<" + pointee.toMlirString() + ">";
    }
}
