package io.surfworks.warplayout.analysis;

import java.util.logging.Logger;

import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.ir.Value;
import io.surfworks.warplayout.ir.layout.Layout;
import io.surfworks.warplayout.ir.layout.LayoutFamily;

/**
 * Collapses every multi-candidate entry of a {@link ValueLayoutMap} to one layout.
 *
 * <p>The first candidate is the default. Results of loads, stores and atomics
 * prefer their first blocked candidate; every other value prefers its first MMA
 * candidate. This is a fixed priority, not a cost model.
 */
public final class ConflictResolver {

    private static final Logger LOG = Logger.getLogger(ConflictResolver.class.getName());

    /**
     * Resolves every entry in place.
     *
     * @return the number of entries that held more than one candidate
     */
    public int resolve(ValueLayoutMap layouts) {
        int conflicts = 0;
        for (Value value : layouts.values()) {
            LayoutInfo info = layouts.get(value);
            if (info.size() <= 1) {
                continue;
            }
            conflicts++;
            Layout chosen = choose(value.getDefiningOp(), info);
            LOG.finer("Resolved " + value + " from " + info + " to " + chosen.toMlirString());
            info.resolveTo(chosen);
        }
        if (conflicts > 0) {
            LOG.fine("Resolved " + conflicts + " layout conflicts");
        }
        return conflicts;
    }

    static Layout choose(Operation def, LayoutInfo info) {
        boolean isMemoryOp = def != null && switch (def.getOpcode()) {
            case LOAD, STORE, ATOMIC_RMW, ATOMIC_CAS -> true;
            default -> false;
        };
        LayoutFamily preferred = isMemoryOp ? LayoutFamily.BLOCKED : LayoutFamily.MMA;
        for (Layout candidate : info.layouts()) {
            if (candidate.family() == preferred) {
                return candidate;
            }
        }
        return info.first();
    }
}
