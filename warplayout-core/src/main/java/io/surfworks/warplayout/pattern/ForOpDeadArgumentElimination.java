package io.surfworks.warplayout.pattern;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.surfworks.warplayout.ir.Block;
import io.surfworks.warplayout.ir.BlockArgument;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.OpResult;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Value;

/**
 * Cuts loop-carried values that nothing observes.
 *
 * <p>A value computed in the loop body is live if the loop result it is yielded
 * to is used, if an operation with side effects consumes it, or if a live value
 * depends on it. A yield operand that is not live and was computed inside the
 * loop is replaced by its own iteration argument; the computation feeding it
 * then becomes dead and the argument is passed through, which
 * {@link ForOpPassThroughArguments} removes.
 *
 * <p>A yield operand defined outside the loop is left alone: the loop result is
 * that value or the initial value depending on whether the loop runs at all.
 */
public final class ForOpDeadArgumentElimination implements RewritePattern {

    @Override
    public String name() {
        return "for-dead-argument-elimination";
    }

    @Override
    public Opcode rootOpcode() {
        return Opcode.FOR;
    }

    @Override
    public String description() {
        return "Yields the iteration argument itself in place of a loop-carried value nothing uses";
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        ForOp forOp = ForOp.wrap(op);
        Block body = forOp.getBody();
        Operation yield = forOp.getYield();
        Set<Value> alive = new HashSet<>();
        Deque<Value> queue = new ArrayDeque<>();

        for (OpResult result : op.getResults()) {
            if (!result.useEmpty()) {
                markLive(yield.getOperand(result.getResultNumber()), op, alive, queue);
            }
        }
        if (alive.size() == op.getNumResults()) {
            return false;
        }
        List<Operation> nested = new ArrayList<>();
        for (Operation inner : body.getOperations()) {
            inner.walk(nested::add);
        }
        for (Operation inner : nested) {
            if (!inner.is(Opcode.YIELD) && !inner.is(Opcode.FOR) && !SideEffects.wouldBeTriviallyDead(inner)) {
                for (Value operand : inner.getOperands()) {
                    markLive(operand, op, alive, queue);
                }
            }
        }

        while (!queue.isEmpty()) {
            Value value = queue.pop();
            Operation def = value.getDefiningOp();
            if (def != null && def.is(Opcode.FOR)) {
                ForOp nestedFor = ForOp.wrap(def);
                int index = ((OpResult) value).getResultNumber();
                markLive(nestedFor.getInitArgs().get(index), op, alive, queue);
                markLive(nestedFor.getYield().getOperand(index), op, alive, queue);
                continue;
            }
            if (def != null && def.is(Opcode.IF)) {
                int index = ((OpResult) value).getResultNumber();
                for (int r = 0; r < def.getNumRegions(); r++) {
                    Operation branchYield = def.getRegion(r).getBlock().getTerminator();
                    if (branchYield != null) {
                        markLive(branchYield.getOperand(index), op, alive, queue);
                    }
                }
                continue;
            }
            if (def != null) {
                if (def.is(Opcode.WHILE)) {
                    return false;
                }
                for (Value operand : def.getOperands()) {
                    markLive(operand, op, alive, queue);
                }
                continue;
            }
            BlockArgument arg = (BlockArgument) value;
            Operation owner = arg.getOwner().getParentOp();
            if (owner != null && owner.is(Opcode.FOR) && arg.getArgNumber() >= ForOp.NUM_INDUCTION_VARS) {
                ForOp ownerFor = ForOp.wrap(owner);
                markLive(ownerFor.getTiedYieldedValue(arg), op, alive, queue);
                markLive(ownerFor.getTiedLoopInit(arg).get(), op, alive, queue);
            }
        }

        List<Integer> deadArgs = new ArrayList<>();
        for (int i = 0; i < yield.getNumOperands(); i++) {
            Value yielded = yield.getOperand(i);
            if (alive.contains(yielded) || yielded == forOp.getRegionIterArg(i)) {
                continue;
            }
            if (!isDefinedInside(yielded, op)) {
                continue;
            }
            deadArgs.add(i);
        }
        if (deadArgs.isEmpty()) {
            return false;
        }
        for (int i : deadArgs) {
            yield.setOperand(i, forOp.getRegionIterArg(i));
        }
        return true;
    }

    private static void markLive(Value value, Operation loop, Set<Value> alive, Deque<Value> queue) {
        if (isDefinedInside(value, loop) && alive.add(value)) {
            queue.push(value);
        }
    }

    private static boolean isDefinedInside(Value value, Operation loop) {
        Operation scope = value.getParentBlock().getParentOp();
        return scope != null && scope.isAncestorOrSelf(loop);
    }
}
