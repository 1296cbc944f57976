package io.surfworks.warplayout.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A module: named functions plus module-level attributes.
 */
public final class Module {

    /** Number of warps per CTA the module is compiled for. */
    public static final String NUM_WARPS_ATTR = "triton_gpu.num-warps";

    /** Number of threads per warp the module is compiled for. */
    public static final String THREADS_PER_WARP_ATTR = "triton_gpu.threads-per-warp";

    private final String name;
    private final List<Function> functions = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public Module(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Function addFunction(Function function) {
        functions.add(function);
        return function;
    }

    public List<Function> functions() {
        return Collections.unmodifiableList(functions);
    }

    public Optional<Function> getFunction(String functionName) {
        return functions.stream()
                .filter(f -> f.name().equals(functionName))
                .findFirst();
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Module setAttribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public Optional<Integer> intAttribute(String key) {
        Object value = attributes.get(key);
        return value instanceof Number n ? Optional.of(n.intValue()) : Optional.empty();
    }

    public void walk(Consumer<Operation> visitor) {
        for (Function f : functions) {
            f.walk(visitor);
        }
    }

    /**
     * Collects every operation with the given opcode across all functions, in program order.
     */
    public List<Operation> collect(Opcode opcode) {
        List<Operation> found = new ArrayList<>();
        for (Function f : functions) {
            found.addAll(f.collect(opcode));
        }
        return found;
    }

    /**
     * Finds the function containing the given operation, if it belongs to this module.
     */
    public Optional<Function> functionOf(Operation op) {
        Operation top = op;
        while (top.getParentOp() != null) {
            top = top.getParentOp();
        }
        Block topBlock = top.getBlock();
        for (Function f : functions) {
            if (f.getEntryBlock() == topBlock) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return String.format("Module[%s, functions=%d]", name, functions.size());
    }
}
