package io.surfworks.warplayout.pattern;

import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;

/**
 * Removes a conversion whose source already has the target type.
 */
public final class FoldIdentityConversion implements RewritePattern {

    @Override
    public String name() {
        return "fold-identity-conversion";
    }

    @Override
    public Opcode rootOpcode() {
        return Opcode.CONVERT_LAYOUT;
    }

    @Override
    public int benefit() {
        return 3;
    }

    @Override
    public String description() {
        return "Replaces cvt(x : T) -> T with x";
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        if (!op.getOperand(0).getType().equals(op.getResult(0).getType())) {
            return false;
        }
        rewriter.replaceOp(op, op.getOperand(0));
        return true;
    }
}
