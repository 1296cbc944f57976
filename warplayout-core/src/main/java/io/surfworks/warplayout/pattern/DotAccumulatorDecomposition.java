package io.surfworks.warplayout.pattern;

import java.util.List;

import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Value;

/**
 * Splits a loaded accumulator out of a matrix multiply so that the load keeps
 * its own layout.
 *
 * <p>Matches the following pattern:
 * <pre>
 * %l   = tt.load %ptr                       : tensor&lt;..., #blocked&gt;
 * %acc = triton_gpu.convert_layout %l       : -&gt; #mma
 * %d   = tt.dot %a, %b, %acc                : #mma
 * %r   = triton_gpu.convert_layout %d       : -&gt; #blocked
 * </pre>
 *
 * <p>where the product and its conversion each have a single use and the final
 * type equals the loaded type. Rewritten output:
 * <pre>
 * %z   = tt.splat 0.0                       : #mma
 * %d2  = tt.dot %a, %b, %z
 * %c   = triton_gpu.convert_layout %d2      : -&gt; #blocked
 * %r   = arith.addf %c, %l
 * </pre>
 *
 * <p>The accumulator then no longer travels through the accelerator layout and back.
 */
public final class DotAccumulatorDecomposition implements RewritePattern {

    @Override
    public String name() {
        return "dot-accumulator-decomposition";
    }

    @Override
    public Opcode rootOpcode() {
        return Opcode.CONVERT_LAYOUT;
    }

    @Override
    public String description() {
        return "Rewrites cvt(dot(a, b, cvt(load))) into addf(cvt(dot(a, b, 0)), load)";
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        Operation dot = op.getOperand(0).getDefiningOp();
        if (dot == null || !dot.is(Opcode.DOT)) {
            return false;
        }
        if (!op.getResult(0).hasOneUse() || !dot.getResult(0).hasOneUse()) {
            return false;
        }
        Operation accConvert = dot.getOperand(2).getDefiningOp();
        if (accConvert == null || !accConvert.is(Opcode.CONVERT_LAYOUT)) {
            return false;
        }
        Value loaded = accConvert.getOperand(0);
        Operation load = loaded.getDefiningOp();
        if (load == null || !load.is(Opcode.LOAD)) {
            return false;
        }
        TensorType resultType = op.getResult(0).tensorType();
        if (!resultType.equals(loaded.getType())) {
            return false;
        }

        IrBuilder builder = rewriter.setInsertionPoint(op);
        TensorType dotType = dot.getResult(0).tensorType();
        Value zero = builder.constant(resultType.elementType(), 0.0);
        Value zeros = builder.splat(zero, dotType);
        Operation newDot = builder.create(Opcode.DOT,
                List.of(dot.getOperand(0), dot.getOperand(1), zeros), List.of(dotType), dot.getAttributes(), 0);
        Value converted = builder.convertLayout(newDot.getResult(0), resultType);
        Value sum = builder.binary(Opcode.ADDF, converted, loaded);
        rewriter.replaceOp(op, sum);
        return true;
    }
}
