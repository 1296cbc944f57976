package io.surfworks.warplayout.pattern;

import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Region;

/**
 * Side-effect queries used to decide whether an operation may be deleted.
 */
final class SideEffects {

    private SideEffects() {}

    /**
     * Returns true if {@code op} can be erased: it is not a terminator, none of
     * its results is used, and it would be dead if they were not.
     */
    static boolean isTriviallyDead(Operation op) {
        return op.resultsUnused() && wouldBeTriviallyDead(op);
    }

    /**
     * Returns true if {@code op} is not a terminator and neither it nor anything
     * nested in it writes memory. Terminators nested in its regions only pass
     * values to {@code op} itself and do not count.
     */
    static boolean wouldBeTriviallyDead(Operation op) {
        return !op.getOpcode().isTerminator() && !hasSideEffectsRecursively(op);
    }

    private static boolean hasSideEffectsRecursively(Operation op) {
        if (op.getOpcode().hasSideEffects() && !isStructuralTerminator(op)) {
            return true;
        }
        for (Region region : op.getRegions()) {
            for (Operation nested : region.getBlock().getOperations()) {
                if (hasSideEffectsRecursively(nested)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isStructuralTerminator(Operation op) {
        return op.is(Opcode.YIELD) || op.is(Opcode.CONDITION);
    }
}
