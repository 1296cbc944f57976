package io.surfworks.warplayout.analysis;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.warplayout.inference.CostModel;
import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.ir.Function;

/**
 * Runs anchor detection, forward propagation and conflict resolution over one
 * function and returns the resolved layout of every value reached.
 *
 * <p>Each call builds a fresh {@link ValueLayoutMap}; nothing is kept between calls.
 */
public final class LayoutPropagation {

    private static final Logger LOG = Logger.getLogger(LayoutPropagation.class.getName());

    private final AnchorDetector anchorDetector;
    private final ForwardPropagator propagator;
    private final ConflictResolver resolver;
    private int lastAnchorCount;

    public LayoutPropagation(LayoutInference inference, CostModel costModel) {
        Objects.requireNonNull(inference, "inference cannot be null");
        Objects.requireNonNull(costModel, "costModel cannot be null");
        this.anchorDetector = new AnchorDetector(costModel);
        this.propagator = new ForwardPropagator(inference);
        this.resolver = new ConflictResolver();
    }

    public ValueLayoutMap analyze(Function function) {
        ValueLayoutMap layouts = anchorDetector.detect(function);
        lastAnchorCount = layouts.size();
        propagator.propagate(layouts);
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("Layouts of @" + function.name() + " after propagation:\n" + layouts.dump());
        }
        resolver.resolve(layouts);
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("Layouts of @" + function.name() + " after resolution:\n" + layouts.dump());
        }
        return layouts;
    }

    /**
     * Returns the number of anchors found by the last {@link #analyze} call.
     */
    public int lastAnchorCount() {
        return lastAnchorCount;
    }
}
