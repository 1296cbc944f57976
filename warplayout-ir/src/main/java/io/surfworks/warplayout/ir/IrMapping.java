package io.surfworks.warplayout.ir;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps original values to their replacements while cloning or rewriting IR.
 */
public final class IrMapping {

    private final Map<Value, Value> values = new IdentityHashMap<>();

    public void map(Value from, Value to) {
        values.put(from, to);
    }

    /**
     * Returns the replacement of {@code value}, or null if none is recorded.
     */
    public Value lookup(Value value) {
        return values.get(value);
    }

    public Value lookupOrDefault(Value value) {
        Value mapped = values.get(value);
        return mapped != null ? mapped : value;
    }

    public boolean contains(Value value) {
        return values.containsKey(value);
    }

    public int size() {
        return values.size();
    }
}
