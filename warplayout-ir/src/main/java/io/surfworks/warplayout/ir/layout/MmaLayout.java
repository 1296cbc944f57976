package io.surfworks.warplayout.ir.layout;

import java.util.List;

/**
 * Accumulator layout of the matrix-multiply units.
 *
 * @param versionMajor hardware generation of the MMA instructions
 * @param versionMinor minor revision
 * @param warpsPerCTA  warps of a CTA laid out along each dimension
 * @param instrShape   shape of one MMA instruction tile
 */
public record MmaLayout(
        int versionMajor,
        int versionMinor,
        List<Integer> warpsPerCTA,
        List<Integer> instrShape
) implements Layout {

    public MmaLayout {
        if (versionMajor < 1) {
            throw new IllegalArgumentException("versionMajor must be >= 1, got " + versionMajor);
        }
        warpsPerCTA = Layouts.requireNonEmpty(warpsPerCTA, "warpsPerCTA");
        instrShape = List.copyOf(instrShape);
    }

    @Override
    public LayoutFamily family() {
        return LayoutFamily.MMA;
    }

    @Override
    public String toMlirString() {
        return "#mma<{versionMajor = " + versionMajor + ", versionMinor = " + versionMinor
                + ", warpsPerCTA = " + Layouts.formatList(warpsPerCTA)
                + ", instrShape = " + Layouts.formatList(instrShape) + "}>";
    }
}
