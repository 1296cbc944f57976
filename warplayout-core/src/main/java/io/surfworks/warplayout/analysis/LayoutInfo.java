package io.surfworks.warplayout.analysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.surfworks.warplayout.ir.layout.Layout;

/**
 * The candidate layouts of one value, in the order they were discovered.
 */
public final class LayoutInfo {

    private final Set<Layout> layouts = new LinkedHashSet<>();

    public LayoutInfo() {}

    public LayoutInfo(Layout initial) {
        layouts.add(Objects.requireNonNull(initial, "initial layout cannot be null"));
    }

    /**
     * Adds a candidate.
     *
     * @return true if the candidate was not already present
     */
    public boolean insert(Layout layout) {
        return layouts.add(Objects.requireNonNull(layout, "layout cannot be null"));
    }

    public boolean contains(Layout layout) {
        return layouts.contains(layout);
    }

    public int size() {
        return layouts.size();
    }

    public boolean isEmpty() {
        return layouts.isEmpty();
    }

    /**
     * Returns the first-discovered candidate, or null if there is none.
     */
    public Layout first() {
        return layouts.isEmpty() ? null : layouts.iterator().next();
    }

    /**
     * Returns a snapshot of the candidates in discovery order.
     */
    public List<Layout> layouts() {
        return List.copyOf(layouts);
    }

    /**
     * Collapses the candidates to exactly {@code layout}.
     */
    public void resolveTo(Layout layout) {
        layouts.clear();
        layouts.add(Objects.requireNonNull(layout, "layout cannot be null"));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Layout l : layouts) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(l.toMlirString());
        }
        return sb.append("}").toString();
    }
}
