package io.surfworks.warplayout.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Candidate layouts of every value the analysis has reached, keyed by value identity.
 *
 * <p>Entries keep their insertion order so that walks over the map, and
 * everything derived from them, are reproducible. One map belongs to one
 * analysis of one function.
 */
public final class ValueLayoutMap {

    private final Map<Value, LayoutInfo> entries = new LinkedHashMap<>();

    /**
     * Adds a candidate layout to a value, creating its entry if needed.
     *
     * @return true if the candidate is new for that value
     */
    public boolean addLayout(Value value, Layout layout) {
        return entries.computeIfAbsent(value, v -> new LayoutInfo()).insert(layout);
    }

    /**
     * Returns the candidates of a value, or null if the value has no entry.
     */
    public LayoutInfo get(Value value) {
        return entries.get(value);
    }

    public boolean contains(Value value) {
        return entries.containsKey(value);
    }

    /**
     * Returns a snapshot of the values with an entry, in insertion order.
     */
    public List<Value> values() {
        return List.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns the single layout a value resolved to, or null if it has no entry.
     *
     * @throws AssertionError if the entry still holds more than one candidate
     */
    public Layout resolvedLayout(Value value) {
        LayoutInfo info = entries.get(value);
        if (info == null) {
            return null;
        }
        if (info.size() != 1) {
            throw new AssertionError("Layout of " + value + " is not resolved: " + info);
        }
        return info.first();
    }

    /**
     * Returns true if every entry holds exactly one candidate.
     */
    public boolean isResolved() {
        for (LayoutInfo info : entries.values()) {
            if (info.size() != 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders every entry on its own line, for debug logging.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Value, LayoutInfo> e : entries.entrySet()) {
            sb.append(e.getKey()).append(" -> ").append(e.getValue()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ValueLayoutMap[values=" + entries.size() + "]";
    }
}
