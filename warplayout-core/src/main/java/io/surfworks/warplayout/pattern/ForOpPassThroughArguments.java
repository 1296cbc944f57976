package io.surfworks.warplayout.pattern;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.warplayout.ir.Block;
import io.surfworks.warplayout.ir.ForOp;
import io.surfworks.warplayout.ir.IrBuilder;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Type;
import io.surfworks.warplayout.ir.Value;

/**
 * Removes iteration arguments that carry nothing.
 *
 * <p>An argument is removed when the loop yields it back unchanged, when the
 * loop yields its initial value, or when neither the argument nor its result is
 * used. The loop is rebuilt without those arguments; uses of a removed argument
 * or result are redirected to the initial value.
 */
public final class ForOpPassThroughArguments implements RewritePattern {

    @Override
    public String name() {
        return "for-pass-through-arguments";
    }

    @Override
    public Opcode rootOpcode() {
        return Opcode.FOR;
    }

    @Override
    public String description() {
        return "Drops loop-carried values that are forwarded unchanged or unused";
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        ForOp forOp = ForOp.wrap(op);
        Operation yield = forOp.getYield();
        List<Value> inits = forOp.getInitArgs();
        List<Integer> kept = new ArrayList<>();
        List<Integer> removed = new ArrayList<>();
        for (int i = 0; i < inits.size(); i++) {
            Value iterArg = forOp.getRegionIterArg(i);
            Value yielded = yield.getOperand(i);
            boolean forwarded = yielded == iterArg
                    || yielded == inits.get(i)
                    || (iterArg.useEmpty() && op.getResult(i).useEmpty());
            (forwarded ? removed : kept).add(i);
        }
        if (removed.isEmpty()) {
            return false;
        }

        List<Value> operands = new ArrayList<>(op.getOperands().subList(0, ForOp.NUM_CONTROL_OPERANDS));
        List<Type> resultTypes = new ArrayList<>();
        for (int i : kept) {
            operands.add(inits.get(i));
            resultTypes.add(inits.get(i).getType());
        }
        IrBuilder builder = rewriter.setInsertionPoint(op);
        Operation newOp = builder.create(Opcode.FOR, operands, resultTypes, op.getAttributes(), 1);
        newOp.getRegion(0).takeBody(op.getRegion(0));
        Block body = newOp.getRegion(0).getBlock();

        for (int i : removed) {
            body.getArgument(i + ForOp.NUM_INDUCTION_VARS).replaceAllUsesWith(inits.get(i));
            op.getResult(i).replaceAllUsesWith(inits.get(i));
        }
        List<Value> yielded = new ArrayList<>();
        for (int i : kept) {
            yielded.add(yield.getOperand(i));
        }
        builder.setInsertionPoint(yield);
        builder.yield(yielded);
        yield.erase();
        for (int r = removed.size() - 1; r >= 0; r--) {
            body.eraseArgument(removed.get(r) + ForOp.NUM_INDUCTION_VARS);
        }
        for (int k = 0; k < kept.size(); k++) {
            op.getResult(kept.get(k)).replaceAllUsesWith(newOp.getResult(k));
        }
        op.erase();
        return true;
    }
}
