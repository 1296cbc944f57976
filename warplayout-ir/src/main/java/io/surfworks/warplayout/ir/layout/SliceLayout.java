package io.surfworks.warplayout.ir.layout;

import java.util.Objects;

/**
 * The layout of {@code parent} with dimension {@code dim} removed.
 */
public record SliceLayout(int dim, Layout parent) implements Layout {

    public SliceLayout {
        if (dim < 0) {
            throw new IllegalArgumentException("dim must be >= 0, got " + dim);
        }
        Objects.requireNonNull(parent, "parent cannot be null");
    }

    @Override
    public LayoutFamily family() {
        return LayoutFamily.SLICE;
    }

    @Override
    public String toMlirString() {
        return "#slice<{dim = " + dim + ", parent = " + parent.toMlirString() + "}>";
    }
}
