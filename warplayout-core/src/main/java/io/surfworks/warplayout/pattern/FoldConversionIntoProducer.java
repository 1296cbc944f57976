package io.surfworks.warplayout.pattern;

import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Recreates a cheap producer directly in the layout its conversion asks for.
 *
 * <p>Splats, ranges, constants, concatenations and reshapes that may reorder
 * elements can produce any register layout at no extra cost. The original
 * producer stays for its other users.
 */
public final class FoldConversionIntoProducer implements RewritePattern {

    @Override
    public String name() {
        return "fold-conversion-into-producer";
    }

    @Override
    public Opcode rootOpcode() {
        return Opcode.CONVERT_LAYOUT;
    }

    @Override
    public String description() {
        return "Replaces cvt(splat | make_range | constant | cat | reshape) with the producer in the target layout";
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        Layout target = op.getResult(0).layout();
        if (target == null || target.isSharedMemory()) {
            return false;
        }
        Operation producer = op.getOperand(0).getDefiningOp();
        if (producer == null || !isCheapProducer(producer)) {
            return false;
        }
        Operation copy = rewriter.setInsertionPoint(op).clone(producer);
        copy.getResult(0).setType(op.getResult(0).getType());
        rewriter.replaceOp(op, copy.getResult(0));
        return true;
    }

    private static boolean isCheapProducer(Operation producer) {
        return switch (producer.getOpcode()) {
            case SPLAT, MAKE_RANGE, CONSTANT, CAT -> true;
            case RESHAPE -> Boolean.TRUE.equals(producer.attribute("allow_reorder"));
            default -> false;
        };
    }
}
