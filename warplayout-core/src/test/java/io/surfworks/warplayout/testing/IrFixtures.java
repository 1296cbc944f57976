package io.surfworks.warplayout.testing;

import java.util.List;

import io.surfworks.warplayout.inference.StandardCostModel;
import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.Module;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.PointerType;
import io.surfworks.warplayout.ir.ScalarType;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Type;
import io.surfworks.warplayout.ir.layout.BlockedLayout;
import io.surfworks.warplayout.ir.layout.DotOperandLayout;
import io.surfworks.warplayout.ir.layout.Layout;
import io.surfworks.warplayout.ir.layout.MmaLayout;
import io.surfworks.warplayout.ir.layout.SharedLayout;

/**
 * Layouts, types and small helpers shared by the core tests.
 *
 * <p>With the default geometry of 4 warps of 32 threads, a 16x16 memory access
 * is expensive and an 8x8 one is cheap.
 */
public final class IrFixtures {

    public static final Layout BLOCKED = new BlockedLayout(List.of(1, 4), List.of(8, 4), List.of(4, 1), List.of(1, 0));
    public static final Layout BLOCKED2 = new BlockedLayout(List.of(4, 1), List.of(4, 8), List.of(1, 4), List.of(0, 1));
    public static final MmaLayout MMA = new MmaLayout(2, 0, List.of(4, 1), List.of(16, 8));
    public static final MmaLayout MMA_V1 = new MmaLayout(1, 0, List.of(4, 1), List.of(16, 8));
    public static final Layout DOT_A = new DotOperandLayout(0, MMA, 2);
    public static final Layout DOT_B = new DotOperandLayout(1, MMA, 2);
    public static final Layout SHARED = new SharedLayout(8, 1, 8, List.of(1, 0));

    public static final List<Integer> SHAPE = List.of(16, 16);
    public static final List<Integer> SMALL_SHAPE = List.of(8, 8);

    public static final PointerType F32_PTR = new PointerType(ScalarType.F32);
    public static final PointerType F16_PTR = new PointerType(ScalarType.F16);

    private IrFixtures() {}

    public static StandardCostModel costModel() {
        return new StandardCostModel(4, 32);
    }

    /**
     * A 16x16 f32 tensor in the given layout.
     */
    public static TensorType f32(Layout layout) {
        return new TensorType(SHAPE, ScalarType.F32, layout);
    }

    /**
     * A 16x16 f16 tensor in the given layout.
     */
    public static TensorType f16(Layout layout) {
        return new TensorType(SHAPE, ScalarType.F16, layout);
    }

    public static TensorType tensor(List<Integer> shape, Type element, Layout layout) {
        return new TensorType(shape, element, layout);
    }

    /**
     * A tensor of pointers to {@code pointer}'s pointee with the given shape and layout.
     */
    public static TensorType pointers(List<Integer> shape, PointerType pointer, Layout layout) {
        return new TensorType(shape, pointer, layout);
    }

    public static Module moduleOf(Function... functions) {
        Module module = new Module("test_module");
        for (Function f : functions) {
            module.addFunction(f);
        }
        return module;
    }

    public static int count(Function function, Opcode opcode) {
        return function.collect(opcode).size();
    }

    public static int count(Module module, Opcode opcode) {
        return module.collect(opcode).size();
    }
}
