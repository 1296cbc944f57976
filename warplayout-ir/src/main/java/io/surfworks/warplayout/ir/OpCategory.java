package io.surfworks.warplayout.ir;

/**
 * Layout-transfer behavior of an operation kind.
 */
public enum OpCategory {
    /** Pure per-element computation; all tensor operands and results share one layout. */
    ELEMENTWISE,
    /** Not elementwise, but operands and results carry the same layout (broadcast). */
    LAYOUT_PRESERVING,
    /** Reduces along one axis; the result layout is a slice of the operand layout. */
    REDUCTION,
    /** Changes the shape: expand_dims, reshape, join, split. */
    SHAPE,
    /** Produces a tensor from scalars or nothing: constant, splat, make_range. */
    CREATION,
    /** Global memory load/store. */
    MEMORY,
    /** Atomic read-modify-write on global memory. */
    ATOMIC,
    /** Matrix multiply-accumulate. */
    MATMUL,
    /** Explicit layout conversion. */
    CONVERSION,
    /** Shared-memory staging ops: allocate, insert-async, extract-slice. */
    SHARED_MEMORY,
    /** Region-holding structured control flow: scf.for, scf.while, scf.if. */
    CONTROL_FLOW,
    /** Block terminators: scf.yield, scf.condition, tt.return. */
    TERMINATOR,
    /** Anything else. */
    OTHER
}
