package io.surfworks.warplayout.rewrite;

import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED;
import static io.surfworks.warplayout.testing.IrFixtures.BLOCKED2;
import static io.surfworks.warplayout.testing.IrFixtures.F16_PTR;
import static io.surfworks.warplayout.testing.IrFixtures.F32_PTR;
import static io.surfworks.warplayout.testing.IrFixtures.SHAPE;
import static io.surfworks.warplayout.testing.IrFixtures.costModel;
import static io.surfworks.warplayout.testing.IrFixtures.count;
import static io.surfworks.warplayout.testing.IrFixtures.f16;
import static io.surfworks.warplayout.testing.IrFixtures.f32;
import static io.surfworks.warplayout.testing.IrFixtures.pointers;
import static io.surfworks.warplayout.testing.IrFixtures.tensor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.warplayout.inference.StandardLayoutInference;
import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.PointerType;
import io.surfworks.warplayout.ir.ScalarType;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Value;

@DisplayName("ConvertHoister")
class ConvertHoisterTest {

    private final StandardLayoutInference inference = new StandardLayoutInference();
    private final ConvertHoister hoister = new ConvertHoister(inference, new Rematerializer(inference, costModel()));

    @Test
    @DisplayName("converts the narrow operand of a float extension instead of its result")
    void aboveExtension() {
        Function f = new Function("f", List.of(F16_PTR));
        IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
        Value ptrs = b.splat(f.getArgument(0), pointers(SHAPE, F16_PTR, BLOCKED));
        Value loaded = b.load(ptrs, f16(BLOCKED));
        Value wide = b.unary(Opcode.EXTF, loaded, f32(BLOCKED));
        Operation convert = b.convertLayout(wide, f32(BLOCKED2)).getDefiningOp();
        b.ret(List.of(convert.getResult(0)));

        assertTrue(hoister.hoist(convert));

        List<Operation> converts = f.collect(Opcode.CONVERT_LAYOUT);
        assertEquals(1, converts.size());
        Operation hoisted = converts.get(0);
        assertSame(loaded, hoisted.getOperand(0));
        assertEquals(f16(BLOCKED2), hoisted.getResult(0).getType());
        Operation returnedBy = f.getEntryBlock().getTerminator().getOperand(0).getDefiningOp();
        assertTrue(returnedBy.is(Opcode.EXTF));
        assertEquals(BLOCKED2, returnedBy.getResult(0).layout());
    }

    @Test
    @DisplayName("converts the input of a broadcast before it grows")
    void aboveBroadcast() {
        TensorType column = tensor(List.of(16, 1), ScalarType.F32, BLOCKED);
        Function f = new Function("f", List.of(new PointerType(column)));
        IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
        Value loaded = b.load(f.getArgument(0), column);
        Value wide = b.broadcast(loaded, f32(BLOCKED));
        Operation convert = b.convertLayout(wide, f32(BLOCKED2)).getDefiningOp();
        b.ret(List.of(convert.getResult(0)));

        assertTrue(hoister.hoist(convert));

        Operation hoisted = f.collect(Opcode.CONVERT_LAYOUT).get(0);
        assertEquals(List.of(16, 1), hoisted.getResult(0).tensorType().shape());
        assertEquals(1, count(f, Opcode.CONVERT_LAYOUT));
    }

    @Test
    @DisplayName("returns false when there is no cast to hoist above")
    void nothingToHoist() {
        Function f = new Function("f", List.of(F32_PTR));
        IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
        Value loaded = b.load(b.splat(f.getArgument(0), pointers(SHAPE, F32_PTR, BLOCKED)), f32(BLOCKED));
        Value e = b.unary(Opcode.EXP, loaded);
        Operation convert = b.convertLayout(e, f32(BLOCKED2)).getDefiningOp();
        b.ret(List.of(convert.getResult(0)));

        assertFalse(hoister.hoist(convert));
        assertEquals(1, count(f, Opcode.CONVERT_LAYOUT));
        assertSame(e, convert.getOperand(0));
    }

    @Test
    @DisplayName("returns false when two casts would each need a conversion")
    void twoBlockingCasts() {
        Function f = new Function("f", List.of(F16_PTR, F16_PTR));
        IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
        Value lhs = b.load(b.splat(f.getArgument(0), pointers(SHAPE, F16_PTR, BLOCKED)), f16(BLOCKED));
        Value rhs = b.load(b.splat(f.getArgument(1), pointers(SHAPE, F16_PTR, BLOCKED)), f16(BLOCKED));
        Value sum = b.binary(Opcode.ADDF,
                b.unary(Opcode.EXTF, lhs, f32(BLOCKED)), b.unary(Opcode.EXTF, rhs, f32(BLOCKED)));
        Operation convert = b.convertLayout(sum, f32(BLOCKED2)).getDefiningOp();
        b.ret(List.of(convert.getResult(0)));

        assertFalse(hoister.hoist(convert));

        assertEquals(1, count(f, Opcode.CONVERT_LAYOUT));
        assertEquals(2, count(f, Opcode.EXTF));
        assertEquals(1, count(f, Opcode.ADDF));
        assertSame(sum, convert.getOperand(0));
        assertSame(convert.getResult(0), f.getEntryBlock().getTerminator().getOperand(0));
    }

    @Test
    @DisplayName("recomputes a cast whose input is cheap and hoists above the other one")
    void absorbsCheapCast() {
        Function f = new Function("f", List.of(F16_PTR, ScalarType.F16));
        IrBuilder b = IrBuilder.atEnd(f.getEntryBlock());
        Value loaded = b.load(b.splat(f.getArgument(0), pointers(SHAPE, F16_PTR, BLOCKED)), f16(BLOCKED));
        Value filled = b.splat(f.getArgument(1), f16(BLOCKED));
        Value sum = b.binary(Opcode.ADDF,
                b.unary(Opcode.EXTF, loaded, f32(BLOCKED)), b.unary(Opcode.EXTF, filled, f32(BLOCKED)));
        Operation convert = b.convertLayout(sum, f32(BLOCKED2)).getDefiningOp();
        b.ret(List.of(convert.getResult(0)));

        assertTrue(hoister.hoist(convert));

        List<Operation> converts = f.collect(Opcode.CONVERT_LAYOUT);
        assertEquals(1, converts.size());
        assertSame(loaded, converts.get(0).getOperand(0));
        assertEquals(f16(BLOCKED2), converts.get(0).getResult(0).getType());
        Operation returnedBy = f.getEntryBlock().getTerminator().getOperand(0).getDefiningOp();
        assertTrue(returnedBy.is(Opcode.ADDF));
        assertEquals(BLOCKED2, returnedBy.getResult(0).layout());
        for (Operation operandDef : List.of(returnedBy.getOperand(0).getDefiningOp(),
                returnedBy.getOperand(1).getDefiningOp())) {
            assertTrue(operandDef.is(Opcode.EXTF));
            assertEquals(BLOCKED2, operandDef.getResult(0).layout());
        }
    }
}
