package io.surfworks.warplayout.ir.layout;

import java.util.List;

/**
 * Swizzled shared-memory layout.
 */
public record SharedLayout(int vec, int perPhase, int maxPhase, List<Integer> order) implements Layout {

    public SharedLayout {
        order = Layouts.requireNonEmpty(order, "order");
    }

    @Override
    public LayoutFamily family() {
        return LayoutFamily.SHARED;
    }

    @Override
    public String toMlirString() {
        return "#shared<{vec = " + vec + ", perPhase = " + perPhase + ", maxPhase = " + maxPhase
                + ", order = " + Layouts.formatList(order) + "}>";
    }
}
