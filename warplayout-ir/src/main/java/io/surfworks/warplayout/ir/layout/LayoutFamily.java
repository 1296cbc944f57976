package io.surfworks.warplayout.ir.layout;

/**
 * Coarse classification of layouts.
 */
public enum LayoutFamily {
    /** Generic register layout, each thread owns a contiguous block of elements. */
    BLOCKED,
    /** Accumulator layout of the matrix-multiply units. */
    MMA,
    /** Operand layout consumed directly by the matrix-multiply units. */
    DOT_OPERAND,
    /** Staging layout in shared memory. */
    SHARED,
    /** A parent layout with one dimension removed (result of a reduction). */
    SLICE
}
