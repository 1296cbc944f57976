package io.surfworks.warplayout.inference;

import java.util.Optional;

import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Layout compatibility oracle.
 *
 * <p>An empty result means no constraint can be derived for that operation and
 * layout; it is not an error.
 */
public interface LayoutInference {

    /**
     * Returns the layout the results of {@code op} take when its operands have
     * {@code sourceLayout}.
     */
    Optional<Layout> inferDestinationLayout(Operation op, Layout sourceLayout);

    /**
     * Returns the layout the operands of {@code op} must have for its results to
     * come out in {@code resultLayout}.
     */
    Optional<Layout> inferSourceLayout(Operation op, Layout resultLayout);
}
