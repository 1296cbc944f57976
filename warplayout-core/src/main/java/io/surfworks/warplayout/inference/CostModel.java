package io.surfworks.warplayout.inference;

import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Cost and foldability oracle.
 */
public interface CostModel {

    /**
     * Returns true if a conversion of the result of {@code op} into {@code layout}
     * can be absorbed by re-creating {@code op} directly in that layout.
     */
    boolean canFoldConversionInto(Operation op, Layout layout);

    /**
     * Returns true if {@code op} is a load or store whose layout is too costly to
     * change, which makes its result an anchor and forbids duplicating it.
     */
    boolean isExpensiveMemoryOp(Operation op);
}
