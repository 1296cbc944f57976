package io.surfworks.warplayout.inference;

import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED;
import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED2;
import static io.surfworks.warplayout.testing.IrFixtures.F32_PTR;
import static io.surfworks.warplayout.testing.IrFixtures.MMA;
import static io.surfworks.warplayout.testing.IrFixtures.SHAPE;
import static io.surfworks.warplayout.testing.IrFixtures.SMALL_SHAPE;
import static io.surfworks.warplayout.testing.IrFixtures.f32;
import static io.surfworks.warplayout.testing.IrFixtures.pointers;
import static io.surfworks.warplayout.testing.IrFixtures.tensor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Module;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.PointerType;
import io.surfworks.warplayout.ir.ScalarType;
import io.surfworks.warplayout.ir.Value;

@DisplayName("StandardCostModel")
class StandardCostModelTest {

    // ==================== Memory operations ====================

    @Nested
    @DisplayName("Expensive memory operations")
    class MemoryTests {

        @ParameterizedTest(name = "{0}x{1} with {2} warps: expensive={3}")
        @CsvSource({
                "16, 16, 4, true",
                "8, 8, 4, false",
                "8, 16, 4, true",
                "16, 16, 8, true",
                "8, 16, 8, false"
        })
        @DisplayName("a tensor load is expensive when it covers every thread")
        void tensorLoad(int rows, int cols, int warps, boolean expensive) {
            Function f = new Function("f", List.of(F32_PTR));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            List<Integer> shape = List.of(rows, cols);
            Value ptrs = b.splat(f.getArgument(0), pointers(shape, F32_PTR, BLOCKED));
            Operation load = b.load(ptrs, tensor(shape, ScalarType.F32, BLOCKED)).getDefiningOp();

            assertEquals(expensive, new StandardCostModel(warps, 32).isExpensiveMemoryOp(load));
        }

        @Test
        @DisplayName("a single-element load is never expensive")
        void singleElement() {
            Function f = new Function("f", List.of(F32_PTR));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            List<Integer> one = List.of(1, 1);
            Value ptrs = b.splat(f.getArgument(0), pointers(one, F32_PTR, BLOCKED));
            Operation load = b.load(ptrs, tensor(one, ScalarType.F32, BLOCKED)).getDefiningOp();

            assertFalse(new StandardCostModel(1, 1).isExpensiveMemoryOp(load));
        }

        @Test
        @DisplayName("a block pointer load is always expensive")
        void blockPointer() {
            PointerType blockPtr = new PointerType(tensor(SMALL_SHAPE, ScalarType.F32, BLOCKED));
            Function f = new Function("f", List.of(blockPtr));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Operation load = b.load(f.getArgument(0), tensor(SMALL_SHAPE, ScalarType.F32, BLOCKED)).getDefiningOp();

            assertTrue(new StandardCostModel(4, 32).isExpensiveMemoryOp(load));
        }

        @Test
        @DisplayName("other operations are not memory operations")
        void notMemory() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Operation exp = b.unary(Opcode.EXP, f.getArgument(0)).getDefiningOp();

            assertFalse(new StandardCostModel(4, 32).isExpensiveMemoryOp(exp));
        }
    }

    // ==================== Folding ====================

    @Nested
    @DisplayName("Conversion folding")
    class FoldingTests {

        @Test
        @DisplayName("creation operations absorb any conversion")
        void creationOps() {
            Function f = new Function("f", List.of(ScalarType.F32));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Operation splat = b.splat(f.getArgument(0), f32(BLOCKED)).getDefiningOp();
            Operation range = b.makeRange(0, 16, tensor(List.of(16), ScalarType.I32, BLOCKED)).getDefiningOp();
            StandardCostModel model = new StandardCostModel(4, 32);

            assertTrue(model.canFoldConversionInto(splat, MMA));
            assertTrue(model.canFoldConversionInto(range, BLOCKED2));
        }

        @Test
        @DisplayName("a reshape absorbs a conversion only when it may reorder")
        void reshape() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value x = f.getArgument(0);
            Operation reorder = b.reshape(x, f32(BLOCKED), true).getDefiningOp();
            Operation strict = b.reshape(x, f32(BLOCKED), false).getDefiningOp();
            StandardCostModel model = new StandardCostModel(4, 32);

            assertTrue(model.canFoldConversionInto(reorder, BLOCKED2));
            assertFalse(model.canFoldConversionInto(strict, BLOCKED2));
        }

        @Test
        @DisplayName("a conversion absorbs another unless it targets a different MMA layout")
        void conversionOfConversion() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Operation cvt = b.convertLayout(f.getArgument(0), f32(BLOCKED2)).getDefiningOp();
            StandardCostModel model = new StandardCostModel(4, 32);

            assertTrue(model.canFoldConversionInto(cvt, BLOCKED));
            assertFalse(model.canFoldConversionInto(cvt, MMA));
        }

        @Test
        @DisplayName("loads do not absorb conversions")
        void loads() {
            Function f = new Function("f", List.of(F32_PTR));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value ptrs = b.splat(f.getArgument(0), pointers(SHAPE, F32_PTR, BLOCKED));
            Operation load = b.load(ptrs, f32(BLOCKED)).getDefiningOp();

            assertFalse(new StandardCostModel(4, 32).canFoldConversionInto(load, BLOCKED2));
        }
    }

    // ==================== Geometry ====================

    @Nested
    @DisplayName("Warp geometry")
    class GeometryTests {

        @Test
        @DisplayName("module attributes override the defaults")
        void moduleAttributes() {
            Module module = new Module("m").setAttribute(Module.NUM_WARPS_ATTR, 8);

            StandardCostModel model = StandardCostModel.forModule(module, 4, 32);

            assertEquals(8, model.numWarps());
            assertEquals(32, model.threadsPerWarp());
        }

        @Test
        @DisplayName("rejects a non-positive geometry")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class, () -> new StandardCostModel(0, 32));
            assertThrows(IllegalArgumentException.class, () -> new StandardCostModel(4, -1));
        }
    }
}
