package io.surfworks.warplayout.analysis;

import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED;
import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED2;
import static io.surfworks.warplayout.testing.IrFixtures.DOT_A;
import static io.surfworks.warplayout.testing.IrFixtures.DOT_B;
import static io.surfworks.warplayout.testing.IrFixtures.F32_PTR;
import static io.surfworks.warplayout.testing.IrFixtures.MMA;
import static io.surfworks.warplayout.testing.IrFixtures.MMA_V1;
import static io.surfworks.warplayout.testing.IrFixtures.SHAPE;
import static io.surfworks.warplayout.testing.IrFixtures.SMALL_SHAPE;
import static io.surfworks.warplayout.testing.IrFixtures.costModel;
import static io.surfworks.warplayout.testing.IrFixtures.f16;
import static io.surfworks.warplayout.testing.IrFixtures.f32;
import static io.surfworks.warplayout.testing.IrFixtures.pointers;
import static io.surfworks.warplayout.testing.IrFixtures.tensor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.ScalarType;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.MmaLayout;

@DisplayName("AnchorDetector")
class AnchorDetectorTest {

    private final AnchorDetector detector = new AnchorDetector(costModel());

    // ==================== Parameters ====================

    @Nested
    @DisplayName("Function parameters")
    class ParameterTests {

        @Test
        @DisplayName("tensor parameters are anchors in declaration order")
        void tensorParameters() {
            Function f = new Function("f", List.of(f32(BLOCKED), ScalarType.F32, f32(MMA)));
            IrBuilder.atEnd(f.getEntryBlock()).ret(List.of());

            ValueLayoutMap anchors = detector.detect(f);

            assertEquals(List.of(f.getArgument(0), f.getArgument(2)), anchors.values());
            assertEquals(BLOCKED, anchors.resolvedLayout(f.getArgument(0)));
            assertEquals(MMA, anchors.resolvedLayout(f.getArgument(2)));
        }
    }

    // ==================== Operations ====================

    @Nested
    @DisplayName("Anchor operations")
    class OperationTests {

        @Test
        @DisplayName("an expensive load is an anchor and a cheap one is not")
        void loads() {
            Function f = new Function("f", List.of(F32_PTR));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value big = b.load(b.splat(f.getArgument(0), pointers(SHAPE, F32_PTR, BLOCKED)), f32(BLOCKED));
            Value small = b.load(b.splat(f.getArgument(0), pointers(SMALL_SHAPE, F32_PTR, BLOCKED2)),
                    tensor(SMALL_SHAPE, ScalarType.F32, BLOCKED2));
            b.ret(List.of(big, small));

            ValueLayoutMap anchors = detector.detect(f);

            assertTrue(anchors.contains(big));
            assertFalse(anchors.contains(small));
            assertTrue(detector.isLayoutAnchor(big.getDefiningOp()));
            assertFalse(detector.isLayoutAnchor(small.getDefiningOp()));
        }

        @Test
        @DisplayName("atomics and reordering reshapes are anchors")
        void atomicsAndReshapes() {
            Function f = new Function("f", List.of(F32_PTR, f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value ptrs = b.splat(f.getArgument(0), pointers(SMALL_SHAPE, F32_PTR, BLOCKED));
            Value old = b.atomicRmw("add", ptrs, b.splat(b.constant(ScalarType.F32, 1.0),
                    tensor(SMALL_SHAPE, ScalarType.F32, BLOCKED)));
            Value reordered = b.reshape(f.getArgument(1), f32(BLOCKED2), true);
            Value strict = b.reshape(f.getArgument(1), f32(BLOCKED2), false);
            b.ret(List.of(old, reordered, strict));

            ValueLayoutMap anchors = detector.detect(f);

            assertTrue(anchors.contains(old));
            assertTrue(anchors.contains(reordered));
            assertFalse(anchors.contains(strict));
        }
    }

    // ==================== MMA results ====================

    @Nested
    @DisplayName("MMA results")
    class MmaTests {

        private Value buildDot(Function f, IrBuilder b) {
            return b.dot(f.getArgument(0), f.getArgument(1), f.getArgument(2));
        }

        private Function dotFunction(MmaLayout accLayout) {
            return new Function("f", List.of(f16(DOT_A), f16(DOT_B), f32(accLayout)));
        }

        @Test
        @DisplayName("a product feeding a dot operand is an anchor")
        void feedsDotOperand() {
            Function f = dotFunction(MMA);
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value d = buildDot(f, b);
            Value e = b.unary(Opcode.EXP, d);
            b.ret(List.of(b.convertLayout(e, f32(DOT_A))));

            assertTrue(detector.detect(f).contains(d));
        }

        @Test
        @DisplayName("a product only converted to a blocked layout is not an anchor")
        void onlyBlockedUsers() {
            Function f = dotFunction(MMA);
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value d = buildDot(f, b);
            b.ret(List.of(b.convertLayout(d, f32(BLOCKED))));

            assertFalse(detector.detect(f).contains(d));
        }

        @Test
        @DisplayName("a version 1 product needs a conversion into its own layout")
        void versionOne() {
            Function toDotOperand = dotFunction(MMA_V1);
            IrBuilder b1 = IrBuilder.atEnd(toDotOperand.getEntryBlock());
            Value d1 = buildDot(toDotOperand, b1);
            b1.ret(List.of(b1.convertLayout(d1, f32(DOT_A))));

            Function toSame = dotFunction(MMA_V1);
            IrBuilder b2 = IrBuilder.atEnd(toSame.getEntryBlock());
            Value d2 = buildDot(toSame, b2);
            Value blocked = b2.convertLayout(d2, f32(BLOCKED));
            b2.ret(List.of(b2.convertLayout(blocked, f32(MMA_V1))));

            assertFalse(detector.detect(toDotOperand).contains(d1));
            assertTrue(detector.detect(toSame).contains(d2));
        }

        @Test
        @DisplayName("the search follows values yielded back into a loop")
        void followsLoopBackEdge() {
            Function f = new Function("f", List.of(f16(DOT_A), f16(DOT_B), f32(MMA),
                    ScalarType.I32, ScalarType.I32, ScalarType.I32));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            ForOp loop = b.forLoop(f.getArgument(3), f.getArgument(4), f.getArgument(5), List.of(f.getArgument(2)));
            IrBuilder body = IrBuilder.atEnd(loop.getBody());
            Value acc = loop.getRegionIterArg(0);
            body.convertLayout(acc, f32(DOT_A));
            Value d = body.dot(f.getArgument(0), f.getArgument(1), acc);
            body.yield(List.of(d));
            b.ret(List.of(loop.getOperation().getResult(0)));

            assertTrue(detector.hasConvertToMmaTransitiveUse(d.getDefiningOp(), MMA));
            assertTrue(detector.detect(f).contains(d));
        }
    }
}
