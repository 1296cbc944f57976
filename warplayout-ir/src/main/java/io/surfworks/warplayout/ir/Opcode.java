package io.surfworks.warplayout.ir;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of operation kinds understood by the IR.
 */
public enum Opcode {
    // Memory
    LOAD("tt.load", OpCategory.MEMORY),
    STORE("tt.store", OpCategory.MEMORY),
    ATOMIC_RMW("tt.atomic_rmw", OpCategory.ATOMIC),
    ATOMIC_CAS("tt.atomic_cas", OpCategory.ATOMIC),

    // Compute
    DOT("tt.dot", OpCategory.MATMUL),
    REDUCE("tt.reduce", OpCategory.REDUCTION),
    ADDF("arith.addf", OpCategory.ELEMENTWISE),
    SUBF("arith.subf", OpCategory.ELEMENTWISE),
    MULF("arith.mulf", OpCategory.ELEMENTWISE),
    DIVF("arith.divf", OpCategory.ELEMENTWISE),
    MAXF("arith.maximumf", OpCategory.ELEMENTWISE),
    ADDI("arith.addi", OpCategory.ELEMENTWISE),
    MULI("arith.muli", OpCategory.ELEMENTWISE),
    CMPF("arith.cmpf", OpCategory.ELEMENTWISE),
    CMPI("arith.cmpi", OpCategory.ELEMENTWISE),
    SELECT("arith.select", OpCategory.ELEMENTWISE),
    EXP("math.exp", OpCategory.ELEMENTWISE),
    EXTF("arith.extf", OpCategory.ELEMENTWISE),
    EXTSI("arith.extsi", OpCategory.ELEMENTWISE),
    EXTUI("arith.extui", OpCategory.ELEMENTWISE),
    TRUNCF("arith.truncf", OpCategory.ELEMENTWISE),
    ADDPTR("tt.addptr", OpCategory.ELEMENTWISE),

    // Shape
    BROADCAST("tt.broadcast", OpCategory.LAYOUT_PRESERVING),
    EXPAND_DIMS("tt.expand_dims", OpCategory.SHAPE),
    RESHAPE("tt.reshape", OpCategory.SHAPE),
    JOIN("tt.join", OpCategory.SHAPE),
    SPLIT("tt.split", OpCategory.SHAPE),
    CAT("tt.cat", OpCategory.OTHER),

    // Creation
    CONSTANT("arith.constant", OpCategory.CREATION),
    SPLAT("tt.splat", OpCategory.CREATION),
    MAKE_RANGE("tt.make_range", OpCategory.CREATION),

    // Layout
    CONVERT_LAYOUT("triton_gpu.convert_layout", OpCategory.CONVERSION),
    ALLOC_TENSOR("triton_gpu.alloc_tensor", OpCategory.SHARED_MEMORY),
    INSERT_SLICE_ASYNC("triton_gpu.insert_slice_async", OpCategory.SHARED_MEMORY),
    EXTRACT_SLICE("tensor.extract_slice", OpCategory.SHARED_MEMORY),

    // Structured control flow
    FOR("scf.for", OpCategory.CONTROL_FLOW),
    WHILE("scf.while", OpCategory.CONTROL_FLOW),
    IF("scf.if", OpCategory.CONTROL_FLOW),
    YIELD("scf.yield", OpCategory.TERMINATOR),
    CONDITION("scf.condition", OpCategory.TERMINATOR),
    RETURN("tt.return", OpCategory.TERMINATOR);

    private static final Map<String, Opcode> BY_MNEMONIC = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            BY_MNEMONIC.put(opcode.mnemonic, opcode);
        }
    }

    private final String mnemonic;
    private final OpCategory category;

    Opcode(String mnemonic, OpCategory category) {
        this.mnemonic = mnemonic;
        this.category = category;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public OpCategory category() {
        return category;
    }

    public static Opcode fromMnemonic(String mnemonic) {
        Opcode opcode = BY_MNEMONIC.get(mnemonic);
        if (opcode == null) {
            throw new IllegalArgumentException("Unknown operation: " + mnemonic);
        }
        return opcode;
    }

    /**
     * Integer and floating-point widening casts.
     */
    public boolean isWidening() {
        return this == EXTF || this == EXTSI || this == EXTUI;
    }

    /**
     * Operations whose effect is more than producing their results.
     *
     * <p>Region-holding operations report false here; whether they are removable
     * depends on their bodies.
     */
    public boolean hasSideEffects() {
        return switch (this) {
            case STORE, ATOMIC_RMW, ATOMIC_CAS, INSERT_SLICE_ASYNC, YIELD, CONDITION, RETURN -> true;
            default -> false;
        };
    }

    /**
     * Operations that read memory but do not write it.
     */
    public boolean isReadOnly() {
        return this == LOAD;
    }

    public boolean isTerminator() {
        return category == OpCategory.TERMINATOR;
    }

    public boolean hasRegions() {
        return category == OpCategory.CONTROL_FLOW;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
