package io.surfworks.warplayout.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.OpOperand;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.WhileOp;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Pushes the candidate layouts of the anchors to their users until no value
 * gains a new candidate.
 *
 * <p>Candidates are only ever added, and they are drawn from the finite set of
 * layouts derivable from the anchors, so the worklist drains.
 *
 * <p>Propagation follows loop-carried values: an init reaches its iteration
 * argument and loop result, a yield reaches the results and arguments it feeds,
 * and {@code scf.condition} reaches the "after" arguments and results of its
 * while loop. Through elementwise, layout-preserving, atomic, reduction, shape
 * and conversion operations the candidates reach the results as the
 * {@link LayoutInference} oracle maps them. Any other user stops propagation.
 */
public final class ForwardPropagator {

    private static final Logger LOG = Logger.getLogger(ForwardPropagator.class.getName());

    private final LayoutInference inference;

    public ForwardPropagator(LayoutInference inference) {
        this.inference = Objects.requireNonNull(inference, "inference cannot be null");
    }

    /**
     * Propagates every entry of {@code layouts} to a fixpoint.
     *
     * @return the number of values processed from the worklist
     */
    public int propagate(ValueLayoutMap layouts) {
        Deque<Value> queue = new ArrayDeque<>(layouts.values());
        int processed = 0;
        while (!queue.isEmpty()) {
            Value value = queue.pollLast();
            processed++;
            for (Value changed : propagateToUsers(value, layouts)) {
                queue.addLast(changed);
            }
        }
        LOG.fine("Propagation reached a fixpoint after " + processed + " steps, " + layouts.size() + " values have a layout");
        return processed;
    }

    private List<Value> propagateToUsers(Value value, ValueLayoutMap layouts) {
        List<Layout> candidates = layouts.get(value).layouts();
        List<Value> changed = new ArrayList<>();
        for (OpOperand use : value.getUses()) {
            Operation user = use.getOwner();
            int index = use.getOperandNumber();
            switch (user.getOpcode()) {
                case FOR -> {
                    ForOp forOp = ForOp.wrap(user);
                    if (forOp.isInitOperand(use)) {
                        setLayouts(List.of(forOp.getTiedLoopRegionIterArg(use), forOp.getTiedLoopResult(use)),
                                candidates, user, layouts, changed);
                    }
                }
                case WHILE -> setLayouts(List.of(WhileOp.wrap(user).getBeforeArguments().get(index)),
                        candidates, user, layouts, changed);
                case YIELD -> setLayouts(yieldTargets(user, index), candidates, user, layouts, changed);
                case CONDITION -> {
                    if (index > 0) {
                        WhileOp whileOp = WhileOp.wrap(user.getParentOp());
                        setLayouts(List.of(whileOp.getAfterArguments().get(index - 1),
                                        whileOp.getOperation().getResult(index - 1)),
                                candidates, user, layouts, changed);
                    }
                }
                default -> {
                    if (propagatesThrough(user)) {
                        setLayouts(new ArrayList<>(user.getResults()), candidates, user, layouts, changed);
                    }
                }
            }
        }
        return changed;
    }

    private static List<Value> yieldTargets(Operation yield, int index) {
        Operation parent = yield.getParentOp();
        List<Value> targets = new ArrayList<>();
        if (parent == null) {
            return targets;
        }
        switch (parent.getOpcode()) {
            case FOR -> {
                targets.add(parent.getResult(index));
                targets.add(ForOp.wrap(parent).getRegionIterArg(index));
            }
            case IF -> targets.add(parent.getResult(index));
            case WHILE -> {
                WhileOp whileOp = WhileOp.wrap(parent);
                targets.add(whileOp.getBeforeArguments().get(index));
                targets.add(parent.getOperand(index));
            }
            default -> { }
        }
        return targets;
    }

    private static boolean propagatesThrough(Operation user) {
        return switch (user.getCategory()) {
            case ELEMENTWISE, LAYOUT_PRESERVING, ATOMIC, REDUCTION, SHAPE, CONVERSION -> true;
            default -> false;
        };
    }

    private void setLayouts(List<Value> targets, List<Layout> candidates, Operation op,
                            ValueLayoutMap layouts, List<Value> changed) {
        for (Value target : targets) {
            if (!target.isTensor()) {
                continue;
            }
            boolean hasChanged = false;
            for (Layout candidate : candidates) {
                Optional<Layout> destination = inference.inferDestinationLayout(op, candidate);
                if (destination.isPresent()) {
                    hasChanged |= layouts.addLayout(target, destination.get());
                }
            }
            if (hasChanged) {
                changed.add(target);
            }
        }
    }
}
