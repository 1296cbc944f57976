package io.surfworks.warplayout.analysis;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.warplayout.inference.CostModel;
import io.surfworks.warplayout.ir.BlockArgument;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.OpResult;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Region;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.DotOperandLayout;
import io.surfworks.warplayout.ir.layout.Layout;
import io.surfworks.warplayout.ir.layout.MmaLayout;

/**
 * Finds the values whose layout must not change and seeds a {@link ValueLayoutMap}
 * with their declared layout.
 *
 * <p>Anchors are the tensor parameters of the function, in declaration order,
 * followed by the tensor results of anchor operations in program order:
 * {@code tt.dot}, atomics, expensive loads and reshapes that allow reordering.
 *
 * <p>A result declared in an MMA layout is only an anchor if some transitive
 * user converts into an MMA or dot-operand layout it is compatible with.
 * Otherwise propagating it would spread the accelerator layout to values that
 * gain nothing from it.
 */
public final class AnchorDetector {

    private static final Logger LOG = Logger.getLogger(AnchorDetector.class.getName());

    private final CostModel costModel;

    public AnchorDetector(CostModel costModel) {
        this.costModel = Objects.requireNonNull(costModel, "costModel cannot be null");
    }

    /**
     * Returns a new map holding one candidate per anchor of {@code function}.
     */
    public ValueLayoutMap detect(Function function) {
        ValueLayoutMap layouts = new ValueLayoutMap();
        for (BlockArgument arg : function.getArguments()) {
            if (arg.isTensor()) {
                layouts.addLayout(arg, arg.layout());
            }
        }
        function.walk(op -> {
            if (!isLayoutAnchor(op)) {
                return;
            }
            for (OpResult result : op.getResults()) {
                if (!result.isTensor()) {
                    continue;
                }
                if (result.layout() instanceof MmaLayout mma && !hasConvertToMmaTransitiveUse(op, mma)) {
                    LOG.finer("Skipping MMA anchor without a converting user: " + result);
                    continue;
                }
                layouts.addLayout(result, result.layout());
            }
        });
        LOG.fine("Found " + layouts.size() + " anchors in @" + function.name());
        return layouts;
    }

    /**
     * Returns true if the results of {@code op} fix their layout.
     */
    public boolean isLayoutAnchor(Operation op) {
        return switch (op.getOpcode()) {
            case LOAD, STORE -> costModel.isExpensiveMemoryOp(op);
            case DOT, ATOMIC_RMW, ATOMIC_CAS -> true;
            case RESHAPE -> Boolean.TRUE.equals(op.attribute("allow_reorder"));
            default -> false;
        };
    }

    /**
     * Searches the transitive users of the first result of {@code op}, following
     * values yielded back into loop iteration arguments, for a conversion into an
     * accelerator layout. The first such conversion decides: an MMA target admits
     * the anchor when its major version is above 1 or it equals {@code layout}; a
     * dot-operand target admits it when {@code layout} has a major version above 1.
     */
    boolean hasConvertToMmaTransitiveUse(Operation op, MmaLayout layout) {
        Deque<Value> queue = new ArrayDeque<>();
        queue.push(op.getResult(0));
        Set<Operation> forwardSlice = new LinkedHashSet<>();
        Set<Value> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        while (!queue.isEmpty()) {
            Value current = queue.pop();
            for (Operation user : current.getUsers()) {
                addToForwardSlice(user, forwardSlice);
            }
            for (Operation sliceOp : List.copyOf(forwardSlice)) {
                if (sliceOp.is(Opcode.CONVERT_LAYOUT)) {
                    Layout target = sliceOp.getResult(0).layout();
                    if (target instanceof MmaLayout mma) {
                        return mma.versionMajor() > 1 || mma.equals(layout);
                    }
                    if (target instanceof DotOperandLayout) {
                        return layout.versionMajor() > 1;
                    }
                }
                if (!sliceOp.is(Opcode.YIELD) || !ForOp.isa(sliceOp.getParentOp())) {
                    continue;
                }
                ForOp forOp = ForOp.wrap(sliceOp.getParentOp());
                for (int i = 0; i < sliceOp.getNumOperands(); i++) {
                    Value yielded = sliceOp.getOperand(i);
                    Operation def = yielded.getDefiningOp();
                    if (def != null && (forwardSlice.contains(def) || yielded == current) && seen.add(yielded)) {
                        queue.push(forOp.getRegionIterArg(i));
                    }
                }
            }
        }
        return false;
    }

    private static void addToForwardSlice(Operation op, Set<Operation> slice) {
        if (!slice.add(op)) {
            return;
        }
        for (Region region : op.getRegions()) {
            for (Operation nested : region.getBlock().getOperations()) {
                addToForwardSlice(nested, slice);
            }
        }
        for (OpResult result : op.getResults()) {
            for (Operation user : result.getUsers()) {
                addToForwardSlice(user, slice);
            }
        }
    }
}
