package io.surfworks.warplayout.inference;

import io.surfworks.warplayout.ir.Module;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.PointerType;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Type;
import io.surfworks.warplayout.ir.layout.Layout;
import io.surfworks.warplayout.ir.layout.LayoutFamily;

/**
 * Cost rules based on the warp geometry of the module.
 *
 * <p>A load or store is cheap when it touches fewer elements than there are
 * threads in a CTA, since every thread then holds at most one element whatever
 * the layout.
 */
public final class StandardCostModel implements CostModel {

    private final int numWarps;
    private final int threadsPerWarp;

    public StandardCostModel(int numWarps, int threadsPerWarp) {
        if (numWarps <= 0 || threadsPerWarp <= 0) {
            throw new IllegalArgumentException(String.format(
                    "numWarps and threadsPerWarp must be positive, got %d and %d", numWarps, threadsPerWarp));
        }
        this.numWarps = numWarps;
        this.threadsPerWarp = threadsPerWarp;
    }

    /**
     * Creates a cost model for a module, letting its
     * {@link Module#NUM_WARPS_ATTR} and {@link Module#THREADS_PER_WARP_ATTR}
     * attributes override the given defaults.
     */
    public static StandardCostModel forModule(Module module, int defaultNumWarps, int defaultThreadsPerWarp) {
        int warps = module.intAttribute(Module.NUM_WARPS_ATTR).orElse(defaultNumWarps);
        int threads = module.intAttribute(Module.THREADS_PER_WARP_ATTR).orElse(defaultThreadsPerWarp);
        return new StandardCostModel(warps, threads);
    }

    public int numWarps() {
        return numWarps;
    }

    public int threadsPerWarp() {
        return threadsPerWarp;
    }

    @Override
    public boolean isExpensiveMemoryOp(Operation op) {
        if (!op.is(Opcode.LOAD) && !op.is(Opcode.STORE)) {
            return false;
        }
        Type pointerType = op.getOperand(0).getType();
        if (pointerType instanceof PointerType ptr) {
            return ptr.isBlockPointer();
        }
        if (pointerType instanceof TensorType tensor) {
            long elements = tensor.numElements();
            if (elements == 1) {
                return false;
            }
            return elements >= (long) numWarps * threadsPerWarp;
        }
        return false;
    }

    @Override
    public boolean canFoldConversionInto(Operation op, Layout layout) {
        return switch (op.getOpcode()) {
            case CONVERT_LAYOUT -> layout.family() != LayoutFamily.MMA || layout.equals(op.getOperand(0).layout());
            case RESHAPE -> Boolean.TRUE.equals(op.attribute("allow_reorder"));
            case CONSTANT, SPLAT, MAKE_RANGE, CAT -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return String.format("StandardCostModel[numWarps=%d, threadsPerWarp=%d]", numWarps, threadsPerWarp);
    }
}
