package io.surfworks.warplayout.pattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.Module;
import io.surfworks.warplayout.ir.Operation;

/**
 * Applies rewrite patterns to a module until none applies.
 *
 * <p>Each sweep first erases trivially dead operations, visiting the module
 * backwards so that a dead chain disappears in one sweep, then offers every
 * remaining operation, in program order, to the patterns rooted at its opcode.
 * Patterns are tried in benefit order and the first one that changes the IR
 * wins. Sweeps repeat until one changes nothing.
 *
 * <p>Example usage:
 * <pre>{@code
 * GreedyPatternDriver cleanup = GreedyPatternDriver.conversionCleanup(10);
 * cleanup.apply(module);
 *
 * System.out.println("Rewrites applied: " + cleanup.lastRewriteCount());
 * }</pre>
 */
public final class GreedyPatternDriver {

    private static final Logger LOG = Logger.getLogger(GreedyPatternDriver.class.getName());

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    private final List<RewritePattern> patterns = new ArrayList<>();
    private final int maxIterations;
    private final Map<String, Integer> lastApplications = new LinkedHashMap<>();
    private int lastRewriteCount;
    private int lastErasedCount;

    public GreedyPatternDriver() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public GreedyPatternDriver(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Adds a pattern.
     *
     * @return this driver for chaining
     */
    public GreedyPatternDriver addPattern(RewritePattern pattern) {
        patterns.add(pattern);
        patterns.sort(Comparator.comparingInt(RewritePattern::benefit).reversed());
        return this;
    }

    /**
     * Creates a driver with the conversion canonicalizations: identity folding,
     * conversion-of-conversion folding and folding into cheap producers.
     */
    public static GreedyPatternDriver conversionCleanup(int maxIterations) {
        return new GreedyPatternDriver(maxIterations)
                .addPattern(new FoldIdentityConversion())
                .addPattern(new FoldConversionOfConversion())
                .addPattern(new FoldConversionIntoProducer());
    }

    /**
     * Creates a driver with the loop cleanups followed by the conversion canonicalizations.
     */
    public static GreedyPatternDriver finalCleanup(int maxIterations) {
        return conversionCleanup(maxIterations)
                .addPattern(new ForOpDeadArgumentElimination())
                .addPattern(new ForOpPassThroughArguments());
    }

    /**
     * Applies the patterns to every function of {@code module}.
     *
     * @return true if the IR changed
     * @throws PatternApplicationException if no fixpoint is reached within the iteration limit
     */
    public boolean apply(Module module) {
        lastRewriteCount = 0;
        lastErasedCount = 0;
        lastApplications.clear();
        boolean changedAny = false;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            List<Operation> ops = new ArrayList<>();
            for (Function function : module.functions()) {
                function.walk(ops::add);
            }
            boolean changed = eraseDeadOps(ops);
            changed |= applyPatterns(ops);
            if (!changed) {
                LOG.fine(String.format("Converged after %d sweeps: %d rewrites, %d dead operations erased",
                        iteration + 1, lastRewriteCount, lastErasedCount));
                return changedAny;
            }
            changedAny = true;
        }
        throw new PatternApplicationException(String.format(
                "Patterns %s did not converge within %d iterations", patternNames(), maxIterations), maxIterations);
    }

    private boolean eraseDeadOps(List<Operation> ops) {
        boolean changed = false;
        for (int i = ops.size() - 1; i >= 0; i--) {
            Operation op = ops.get(i);
            if (!op.isErased() && SideEffects.isTriviallyDead(op)) {
                op.erase();
                lastErasedCount++;
                changed = true;
            }
        }
        return changed;
    }

    private boolean applyPatterns(List<Operation> ops) {
        boolean changed = false;
        PatternRewriter rewriter = new PatternRewriter();
        for (Operation op : ops) {
            if (op.isErased()) {
                continue;
            }
            for (RewritePattern pattern : patterns) {
                if (pattern.rootOpcode() != op.getOpcode()) {
                    continue;
                }
                if (pattern.matchAndRewrite(op, rewriter)) {
                    LOG.finer("Applied " + pattern.name() + " at " + op);
                    lastApplications.merge(pattern.name(), 1, Integer::sum);
                    lastRewriteCount++;
                    changed = true;
                    break;
                }
            }
        }
        return changed;
    }

    private List<String> patternNames() {
        List<String> names = new ArrayList<>();
        for (RewritePattern p : patterns) {
            names.add(p.name());
        }
        return names;
    }

    /**
     * Returns the number of pattern applications in the last {@link #apply} call.
     */
    public int lastRewriteCount() {
        return lastRewriteCount;
    }

    /**
     * Returns the number of dead operations erased in the last {@link #apply} call.
     */
    public int lastErasedCount() {
        return lastErasedCount;
    }

    /**
     * Returns how often each pattern applied in the last {@link #apply} call, by name.
     */
    public Map<String, Integer> lastApplications() {
        return Map.copyOf(lastApplications);
    }

    /**
     * Returns the registered patterns in the order they are tried.
     */
    public List<RewritePattern> patterns() {
        return List.copyOf(patterns);
    }

    @Override
    public String toString() {
        return String.format("GreedyPatternDriver[patterns=%d, lastRewrites=%d]",
                patterns.size(), lastRewriteCount);
    }
}
