package io.surfworks.warplayout.pattern;

import java.util.List;

import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Value;

/**
 * The mutation interface handed to a {@link RewritePattern}.
 */
public final class PatternRewriter {

    private final IrBuilder builder = new IrBuilder();

    /**
     * Positions the builder before {@code op} and returns it.
     */
    public IrBuilder setInsertionPoint(Operation op) {
        builder.setInsertionPoint(op);
        return builder;
    }

    public IrBuilder builder() {
        return builder;
    }

    /**
     * Redirects every use of the results of {@code op} and erases it.
     */
    public void replaceOp(Operation op, List<? extends Value> replacements) {
        op.replaceAllUsesWith(replacements);
        op.erase();
    }

    public void replaceOp(Operation op, Value replacement) {
        replaceOp(op, List.of(replacement));
    }

    public void eraseOp(Operation op) {
        op.erase();
    }
}
