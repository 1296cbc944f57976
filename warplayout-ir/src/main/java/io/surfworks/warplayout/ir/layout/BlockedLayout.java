package io.surfworks.warplayout.ir.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Blocked register layout: {@code #blocked<{sizePerThread, threadsPerWarp, warpsPerCTA, order}>}.
 *
 * @param sizePerThread  contiguous elements owned by one thread, per dimension
 * @param threadsPerWarp threads of a warp laid out along each dimension
 * @param warpsPerCTA    warps of a CTA laid out along each dimension
 * @param order          dimensions from fastest to slowest varying
 */
public record BlockedLayout(
        List<Integer> sizePerThread,
        List<Integer> threadsPerWarp,
        List<Integer> warpsPerCTA,
        List<Integer> order
) implements Layout {

    public BlockedLayout {
        sizePerThread = Layouts.requireNonEmpty(sizePerThread, "sizePerThread");
        threadsPerWarp = Layouts.requireNonEmpty(threadsPerWarp, "threadsPerWarp");
        warpsPerCTA = Layouts.requireNonEmpty(warpsPerCTA, "warpsPerCTA");
        order = Layouts.requireNonEmpty(order, "order");
        int rank = sizePerThread.size();
        if (threadsPerWarp.size() != rank || warpsPerCTA.size() != rank || order.size() != rank) {
            throw new IllegalArgumentException("BlockedLayout parameters must all have rank " + rank);
        }
    }

    public int rank() {
        return sizePerThread.size();
    }

    /**
     * Returns this layout with a new fastest-varying trailing dimension of the given size per thread.
     */
    public BlockedLayout appendDim(int size) {
        List<Integer> spt = new ArrayList<>(sizePerThread);
        spt.add(size);
        List<Integer> tpw = new ArrayList<>(threadsPerWarp);
        tpw.add(1);
        List<Integer> wpc = new ArrayList<>(warpsPerCTA);
        wpc.add(1);
        List<Integer> ord = new ArrayList<>();
        ord.add(rank());
        ord.addAll(order);
        return new BlockedLayout(spt, tpw, wpc, ord);
    }

    /**
     * Returns this layout without its last dimension, or null if the last dimension
     * is not a purely thread-local fastest-varying one of the given size.
     */
    public BlockedLayout dropLastDim(int size) {
        int last = rank() - 1;
        if (last < 1
                || sizePerThread.get(last) != size
                || threadsPerWarp.get(last) != 1
                || warpsPerCTA.get(last) != 1
                || order.get(0) != last) {
            return null;
        }
        return new BlockedLayout(
                sizePerThread.subList(0, last),
                threadsPerWarp.subList(0, last),
                warpsPerCTA.subList(0, last),
                order.subList(1, order.size()));
    }

    @Override
    public LayoutFamily family() {
        return LayoutFamily.BLOCKED;
    }

    @Override
    public String toMlirString() {
        return "#blocked<{sizePerThread = " + Layouts.formatList(sizePerThread)
                + ", threadsPerWarp = " + Layouts.formatList(threadsPerWarp)
                + ", warpsPerCTA = " + Layouts.formatList(warpsPerCTA)
                + ", order = " + Layouts.formatList(order) + "}>";
    }
}
