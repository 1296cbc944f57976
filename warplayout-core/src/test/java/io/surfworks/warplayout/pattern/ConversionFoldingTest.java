package io.surfworks.warplayout.pattern;

import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED;
import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED2;
import static io.surfworks.warplayout.testing.IrFixtures.MMA;
import static io.surfworks.warplayout.testing.IrFixtures.SHARED;
import static io.surfworks.warplayout.testing.IrFixtures.count;
import static io.surfworks.warplayout.testing.IrFixtures.f32;
import static io.surfworks.warplayout.testing.IrFixtures.moduleOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.ScalarType;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.SharedLayout;

@DisplayName("Conversion folding patterns")
class ConversionFoldingTest {

    private final PatternRewriter rewriter = new PatternRewriter();

    private static Operation returnOf(Function f) {
        return f.getEntryBlock().getTerminator();
    }

    // ==================== Identity ====================

    @Nested
    @DisplayName("FoldIdentityConversion")
    class IdentityTests {

        private final FoldIdentityConversion pattern = new FoldIdentityConversion();

        @Test
        @DisplayName("replaces a conversion to the same type with its source")
        void foldsIdentity() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Operation cvt = b.convertLayout(f.getArgument(0), f32(BLOCKED)).getDefiningOp();
            b.ret(List.of(cvt.getResult(0)));

            assertTrue(pattern.matchAndRewrite(cvt, rewriter));

            assertTrue(cvt.isErased());
            assertSame(f.getArgument(0), returnOf(f).getOperand(0));
        }

        @Test
        @DisplayName("leaves a real conversion alone")
        void keepsRealConversion() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Operation cvt = b.convertLayout(f.getArgument(0), f32(BLOCKED2)).getDefiningOp();
            b.ret(List.of(cvt.getResult(0)));

            assertFalse(pattern.matchAndRewrite(cvt, rewriter));
            assertFalse(cvt.isErased());
        }

        @Test
        @DisplayName("is tried before every other conversion pattern")
        void highestBenefit() {
            assertTrue(pattern.benefit() > new FoldConversionOfConversion().benefit());
            assertTrue(pattern.benefit() > new FoldConversionIntoProducer().benefit());
        }
    }

    // ==================== Conversion of conversion ====================

    @Nested
    @DisplayName("FoldConversionOfConversion")
    class ChainTests {

        private final FoldConversionOfConversion pattern = new FoldConversionOfConversion();

        @Test
        @DisplayName("converts directly from the original source")
        void collapsesChain() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value middle = b.convertLayout(f.getArgument(0), f32(MMA));
            Operation outer = b.convertLayout(middle, f32(BLOCKED2)).getDefiningOp();
            b.ret(List.of(outer.getResult(0)));

            assertTrue(pattern.matchAndRewrite(outer, rewriter));

            Operation folded = returnOf(f).getOperand(0).getDefiningOp();
            assertTrue(folded.is(Opcode.CONVERT_LAYOUT));
            assertSame(f.getArgument(0), folded.getOperand(0));
            assertEquals(f32(BLOCKED2), folded.getResult(0).getType());
        }

        @Test
        @DisplayName("a round trip back to the source type disappears")
        void roundTrip() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value middle = b.convertLayout(f.getArgument(0), f32(MMA));
            Operation outer = b.convertLayout(middle, f32(BLOCKED)).getDefiningOp();
            b.ret(List.of(outer.getResult(0)));

            assertTrue(pattern.matchAndRewrite(outer, rewriter));

            assertSame(f.getArgument(0), returnOf(f).getOperand(0));
        }

        @Test
        @DisplayName("keeps staging through a vectorized shared layout")
        void keepsVectorizedShared() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value staged = b.convertLayout(f.getArgument(0), f32(SHARED));
            Operation outer = b.convertLayout(staged, f32(BLOCKED2)).getDefiningOp();
            b.ret(List.of(outer.getResult(0)));

            assertFalse(pattern.matchAndRewrite(outer, rewriter));
            assertSame(staged, outer.getOperand(0));
        }

        @Test
        @DisplayName("folds through a shared layout without vectorization")
        void foldsUnvectorizedShared() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value staged = b.convertLayout(f.getArgument(0), f32(new SharedLayout(1, 1, 1, List.of(1, 0))));
            Operation outer = b.convertLayout(staged, f32(BLOCKED2)).getDefiningOp();
            b.ret(List.of(outer.getResult(0)));

            assertTrue(pattern.matchAndRewrite(outer, rewriter));
        }
    }

    // ==================== Cheap producers ====================

    @Nested
    @DisplayName("FoldConversionIntoProducer")
    class ProducerTests {

        private final FoldConversionIntoProducer pattern = new FoldConversionIntoProducer();

        @Test
        @DisplayName("recreates a splat in the target layout")
        void splat() {
            Function f = new Function("f", List.of(ScalarType.F32));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value splat = b.splat(f.getArgument(0), f32(BLOCKED));
            Operation cvt = b.convertLayout(splat, f32(BLOCKED2)).getDefiningOp();
            b.ret(List.of(cvt.getResult(0)));

            assertTrue(pattern.matchAndRewrite(cvt, rewriter));

            Operation copy = returnOf(f).getOperand(0).getDefiningOp();
            assertTrue(copy.is(Opcode.SPLAT));
            assertEquals(f32(BLOCKED2), copy.getResult(0).getType());
            assertSame(f.getArgument(0), copy.getOperand(0));
        }

        @Test
        @DisplayName("recreates a constant in the target layout")
        void constant() {
            Function f = new Function("f", List.of());
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value zeros = b.constant(f32(BLOCKED), 0.0);
            Operation cvt = b.convertLayout(zeros, f32(MMA)).getDefiningOp();
            b.ret(List.of(cvt.getResult(0)));

            assertTrue(pattern.matchAndRewrite(cvt, rewriter));

            Operation copy = returnOf(f).getOperand(0).getDefiningOp();
            assertTrue(copy.is(Opcode.CONSTANT));
            assertEquals(MMA, copy.getResult(0).layout());
        }

        @Test
        @DisplayName("does not fold into a conversion to shared memory")
        void skipsSharedTarget() {
            Function f = new Function("f", List.of(ScalarType.F32));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value splat = b.splat(f.getArgument(0), f32(BLOCKED));
            Operation cvt = b.convertLayout(splat, f32(SHARED)).getDefiningOp();
            b.ret(List.of(cvt.getResult(0)));

            assertFalse(pattern.matchAndRewrite(cvt, rewriter));
        }

        @Test
        @DisplayName("does not fold into arithmetic")
        void skipsArithmetic() {
            Function f = new Function("f", List.of(f32(BLOCKED)));
            IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
            Value e = b.unary(Opcode.EXP, f.getArgument(0));
            Operation cvt = b.convertLayout(e, f32(BLOCKED2)).getDefiningOp();
            b.ret(List.of(cvt.getResult(0)));

            assertFalse(pattern.matchAndRewrite(cvt, rewriter));
        }
    }

    // ==================== Through the driver ====================

    @Test
    @DisplayName("the cleanup driver removes the original producer once it is dead")
    void cleanupErasesDeadProducer() {
        Function f = new Function("f", List.of(ScalarType.F32));
        IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
        Value splat = b.splat(f.getArgument(0), f32(BLOCKED));
        Value middle = b.convertLayout(splat, f32(MMA));
        b.ret(List.of(b.convertLayout(middle, f32(BLOCKED2))));

        GreedyPatternDriver driver = GreedyPatternDriver.conversionCleanup(10);
        assertTrue(driver.apply(moduleOf(f)));

        assertEquals(0, count(f, Opcode.CONVERT_LAYOUT));
        assertEquals(1, count(f, Opcode.SPLAT));
        assertEquals(BLOCKED2, returnOf(f).getOperand(0).layout());
    }
}
