package io.surfworks.warplayout.analysis;

import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED;
import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED2;
import static io.surfworks.warplayout.testing.IrFixtures.F32_PTR;
import static io.surfworks.warplayout.testing.IrFixtures.SMALL_SHAPE;
import static io.surfworks.warplayout.testing.IrFixtures.costModel;
import static io.surfworks.warplayout.testing.IrFixtures.f32;
import static io.surfworks.warplayout.testing.IrFixtures.pointers;
import static io.surfworks.warplayout.testing.IrFixtures.tensor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.warplayout.inference.CostModel;
import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.inference.StandardLayoutInference;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.ScalarType;
import io.surfworks.warplayout.ir.Value;

@DisplayName("BackwardSlice")
class BackwardSliceTest {

    private final LayoutInference inference = new StandardLayoutInference();
    private final CostModel costModel = costModel();

    // ==================== Straight-line code ====================

    @Nested
    @DisplayName("Straight-line code")
    class StraightLineTests {

        private Value ptrs;
        private Value loaded;
        private Value exp;

        private Function cheapChain() {
            Function f = new Function("f", List.of(F32_PTR));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            ptrs = b.splat(f.getArgument(0), pointers(SMALL_SHAPE, F32_PTR, BLOCKED));
            loaded = b.load(ptrs, tensor(SMALL_SHAPE, ScalarType.F32, BLOCKED));
            exp = b.unary(Opcode.EXP, loaded);
            b.ret(List.of(b.convertLayout(exp, tensor(SMALL_SHAPE, ScalarType.F32, BLOCKED2))));
            return f;
        }

        @Test
        @DisplayName("walks back to a producer that absorbs the conversion")
        void walksToProducer() {
            cheapChain();

            Optional<BackwardSlice> slice = BackwardSlice.compute(exp, BLOCKED2, inference, costModel, null);

            assertTrue(slice.isPresent());
            assertEquals(List.of(exp, loaded, ptrs), slice.get().values());
            assertEquals(BLOCKED2, slice.get().layoutOf(exp));
            assertEquals(BLOCKED2, slice.get().layoutOf(ptrs));
        }

        @Test
        @DisplayName("does not descend past a stopping operation")
        void stopPredicate() {
            cheapChain();

            Optional<BackwardSlice> slice = BackwardSlice.compute(exp, BLOCKED2, inference, costModel,
                    op -> op.is(Opcode.LOAD));

            assertTrue(slice.isPresent());
            assertEquals(List.of(exp, loaded), slice.get().values());
        }

        @Test
        @DisplayName("fails at a function argument")
        void failsAtFunctionArgument() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value e = b.unary(Opcode.EXP, f.getArgument(0));
            b.ret(List.of(e));

            assertTrue(BackwardSlice.compute(e, BLOCKED2, inference, costModel, null).isEmpty());
        }

        @Test
        @DisplayName("fails when an operation has no operand layout")
        void failsAtOpaqueOperation() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value x = f.getArgument(0);
            Value d = b.dot(x, x, x);
            b.ret(List.of(d));

            assertTrue(BackwardSlice.compute(d, BLOCKED2, inference, costModel, null).isEmpty());
        }
    }

    // ==================== Loops ====================

    @Nested
    @DisplayName("Loops")
    class LoopTests {

        @Test
        @DisplayName("an iteration argument pulls in its init and yielded value")
        void iterationArgument() {
            Function f = new Function("f", List.of(ScalarType.F32, ScalarType.I32, ScalarType.I32, ScalarType.I32));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value init = b.splat(f.getArgument(0), f32(BLOCKED));
            ForOp loop = b.forLoop(f.getArgument(1), f.getArgument(2), f.getArgument(3), List.of(init));
            IrBuilder body = IrBuilder.atEnd(loop.getBody());
            Value arg = loop.getRegionIterArg(0);
            Value e = body.unary(Opcode.EXP, arg);
            body.yield(List.of(e));
            b.ret(List.of(loop.getOperation().getResult(0)));

            Optional<BackwardSlice> slice = BackwardSlice.compute(arg, BLOCKED2, inference, costModel, null);

            assertTrue(slice.isPresent());
            assertEquals(3, slice.get().size());
            assertEquals(arg, slice.get().get(0));
            assertTrue(slice.get().contains(init));
            assertTrue(slice.get().contains(e));
        }

        @Test
        @DisplayName("fails at a loop result")
        void failsAtLoopResult() {
            Function f = new Function("f", List.of(ScalarType.F32, ScalarType.I32, ScalarType.I32, ScalarType.I32));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value init = b.splat(f.getArgument(0), f32(BLOCKED));
            ForOp loop = b.forLoop(f.getArgument(1), f.getArgument(2), f.getArgument(3), List.of(init));
            IrBuilder.atEnd(loop.getBody()).yield(List.of(loop.getRegionIterArg(0)));
            Value result = loop.getOperation().getResult(0);
            b.ret(List.of(result));

            assertTrue(BackwardSlice.compute(result, BLOCKED2, inference, costModel, null).isEmpty());
        }
    }

    // ==================== Editing ====================

    @Nested
    @DisplayName("Editing")
    class EditingTests {

        @Test
        @DisplayName("merging keeps the layouts already recorded")
        void mergeKeepsExisting() {
            Function f = new Function("f", List.of(f32(BLOCKED), f32(BLOCKED)));
            Value x = f.getArgument(0);
            Value y = f.getArgument(1);
            BackwardSlice first = new BackwardSlice();
            first.add(x, BLOCKED);
            BackwardSlice second = new BackwardSlice();
            second.add(x, BLOCKED2);
            second.add(y, BLOCKED2);

            first.addAll(second);
            first.remove(x);

            assertFalse(first.contains(x));
            assertEquals(List.of(y), first.values());
            assertEquals(BLOCKED2, first.layoutOf(y));
            assertNull(new BackwardSlice().layoutOf(y));
        }
    }
}
