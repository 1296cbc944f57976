package io.surfworks.warplayout.rewrite;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.warplayout.analysis.BackwardSlice;
import io.surfworks.warplayout.analysis.TopologicalOrder;
import io.surfworks.warplayout.ir.Block;
import io.surfworks.warplayout.ir.BlockArgument;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.IrMapping;
import io.surfworks.warplayout.ir.OpOperand;
import io.surfworks.warplayout.ir.OpResult;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.TensorType;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.Layout;

/**
 * Recomputes a backward slice in the layouts recorded for it and replaces the
 * conversion at its root with the recomputed source.
 *
 * <p>Operations are duplicated, not moved: the originals stay for their other
 * users and are removed by the cleanup patterns if they end up unused. A loop
 * whose iteration arguments are in the slice is replaced by one that carries
 * the recomputed values as extra iteration arguments.
 */
public final class SliceRewriter {

    private static final Logger LOG = Logger.getLogger(SliceRewriter.class.getName());

    public void rewrite(BackwardSlice slice, Operation convert) {
        rewrite(slice, convert, new IrMapping());
    }

    /**
     * Rewrites the slice starting from an existing mapping, which the hoister uses
     * to supply the replacement of a value it recreated itself.
     */
    public void rewrite(BackwardSlice slice, Operation convert, IrMapping mapping) {
        Set<Operation> opsToRewrite = new LinkedHashSet<>();
        for (Value v : slice.values()) {
            Operation def = v.getDefiningOp();
            if (def != null) {
                opsToRewrite.add(def);
            } else {
                Block owner = ((BlockArgument) v).getOwner();
                opsToRewrite.add(owner.getParentOp());
                opsToRewrite.add(owner.getTerminator());
            }
        }

        List<Operation> deadLoops = new ArrayList<>();
        IrBuilder builder = new IrBuilder();
        for (Operation op : TopologicalOrder.sort(opsToRewrite)) {
            if (op.is(Opcode.FOR)) {
                deadLoops.add(op);
                rewriteLoop(ForOp.wrap(op), slice, mapping, builder);
                continue;
            }
            builder.setInsertionPoint(op);
            if (op.is(Opcode.YIELD)) {
                // One extra operand per iteration argument in the slice, in the order rewriteLoop added them.
                ForOp loop = ForOp.wrap(op.getParentOp());
                List<Value> operands = new ArrayList<>(op.getOperands());
                for (int i = 0; i < op.getNumOperands(); i++) {
                    if (slice.contains(loop.getRegionIterArg(i))) {
                        operands.add(lookup(mapping, op.getOperand(i)));
                    }
                }
                builder.yield(operands);
                op.erase();
                continue;
            }
            if (op.is(Opcode.CONSTANT)) {
                Operation copy = builder.clone(op);
                TensorType type = op.getResult(0).tensorType();
                Value converted = builder.convertLayout(copy.getResult(0),
                        type.withLayout(slice.layoutOf(op.getResult(0))));
                mapping.map(op.getResult(0), converted);
                continue;
            }
            Operation copy = builder.clone(op, mapping);
            for (OpResult result : op.getResults()) {
                Layout layout = slice.layoutOf(result);
                if (layout != null && result.getType() instanceof TensorType tensor) {
                    copy.getResult(result.getResultNumber()).setType(tensor.withLayout(layout));
                }
            }
        }

        Value replacement = lookup(mapping, convert.getOperand(0));
        convert.getResult(0).replaceAllUsesWith(replacement);
        convert.erase();
        for (Operation loop : deadLoops) {
            loop.erase();
        }
        LOG.finer("Rewrote a slice of " + slice.size() + " values across " + opsToRewrite.size() + " operations");
    }

    private static void rewriteLoop(ForOp forOp, BackwardSlice slice, IrMapping mapping, IrBuilder builder) {
        List<int[]> argMapping = new ArrayList<>();
        List<Value> newOperands = new ArrayList<>();
        int numIterArgs = forOp.getNumIterArgs();
        for (BlockArgument arg : forOp.getRegionIterArgs()) {
            if (!slice.contains(arg)) {
                continue;
            }
            OpOperand init = forOp.getTiedLoopInit(arg);
            argMapping.add(new int[] {forOp.getTiedLoopResult(init).getResultNumber(), numIterArgs + newOperands.size()});
            newOperands.add(lookup(mapping, init.get()));
        }
        ForOp newFor = forOp.replaceWithNewSignature(builder, newOperands);
        Block body = newFor.getBody();
        for (int[] m : argMapping) {
            mapping.map(newFor.getOperation().getResult(m[0]), newFor.getOperation().getResult(m[1]));
            mapping.map(body.getArgument(m[0] + ForOp.NUM_INDUCTION_VARS),
                    body.getArgument(m[1] + ForOp.NUM_INDUCTION_VARS));
        }
    }

    private static Value lookup(IrMapping mapping, Value value) {
        Value mapped = mapping.lookup(value);
        if (mapped == null) {
            throw new AssertionError("No recomputed value for " + value);
        }
        return mapped;
    }
}
