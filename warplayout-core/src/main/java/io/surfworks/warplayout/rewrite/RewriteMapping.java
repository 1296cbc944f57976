package io.surfworks.warplayout.rewrite;

import java.util.HashMap;
import java.util.Map;

import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Remembers, for an original value, the replacement created for it in each layout,
 * and the conversions already inserted for a value.
 */
final class RewriteMapping {

    private final Map<Value, Map<Layout, Value>> rewritten = new HashMap<>();
    private final Map<Value, Map<Layout, Value>> conversions = new HashMap<>();

    /**
     * Records {@code replacement} as the version of {@code original} in the
     * replacement's own layout.
     */
    void map(Value original, Value replacement) {
        rewritten.computeIfAbsent(original, v -> new HashMap<>()).put(replacement.layout(), replacement);
    }

    Value lookup(Value original, Layout layout) {
        Map<Layout, Value> byLayout = rewritten.get(original);
        return byLayout == null ? null : byLayout.get(layout);
    }

    void cacheConversion(Value source, Layout layout, Value converted) {
        conversions.computeIfAbsent(source, v -> new HashMap<>()).put(layout, converted);
    }

    Value cachedConversion(Value source, Layout layout) {
        Map<Layout, Value> byLayout = conversions.get(source);
        return byLayout == null ? null : byLayout.get(layout);
    }

    int size() {
        return rewritten.size();
    }
}
