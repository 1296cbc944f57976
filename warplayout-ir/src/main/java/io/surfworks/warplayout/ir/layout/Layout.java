package io.surfworks.warplayout.ir.layout;

/**
 * Describes how the elements of a tensor are distributed over the hardware.
 *
 * <p>Layouts are values: two layouts with the same parameters are equal and
 * hash alike. The layout pass itself only relies on equality and on the
 * {@link #family()} classification; everything else a layout knows is used by
 * the inference rules.
 */
public sealed interface Layout
        permits BlockedLayout, MmaLayout, DotOperandLayout, SharedLayout, SliceLayout {

    /**
     * Returns the family this layout belongs to.
     */
    LayoutFamily family();

    /**
     * Returns the attribute syntax used when printing types, e.g. {@code #blocked<...>}.
     */
    String toMlirString();

    /**
     * Returns true if this layout lives in shared (staging) memory rather than registers.
     */
    default boolean isSharedMemory() {
        return family() == LayoutFamily.SHARED;
    }
}
