package io.surfworks.warplayout.pattern;

import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.SharedLayout;

/**
 * Collapses a chain of two conversions into one from the original source.
 *
 * <p>A vectorized shared-memory layout in the middle of the chain is kept:
 * staging through it is deliberate.
 */
public final class FoldConversionOfConversion implements RewritePattern {

    @Override
    public String name() {
        return "fold-conversion-of-conversion";
    }

    @Override
    public Opcode rootOpcode() {
        return Opcode.CONVERT_LAYOUT;
    }

    @Override
    public int benefit() {
        return 2;
    }

    @Override
    public String description() {
        return "Replaces cvt(cvt(x)) with cvt(x)";
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        Operation inner = op.getOperand(0).getDefiningOp();
        if (inner == null || !inner.is(Opcode.CONVERT_LAYOUT)) {
            return false;
        }
        if (inner.getResult(0).layout() instanceof SharedLayout shared && shared.vec() > 1) {
            return false;
        }
        Value source = inner.getOperand(0);
        TensorType resultType = op.getResult(0).tensorType();
        if (source.getType().equals(resultType)) {
            rewriter.replaceOp(op, source);
            return true;
        }
        Value folded = rewriter.setInsertionPoint(op).convertLayout(source, resultType);
        rewriter.replaceOp(op, folded);
        return true;
    }
}
