package io.surfworks.warplayout.pass;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.warplayout.analysis.LayoutPropagation;
import io.surfworks.warplayout.analysis.ValueLayoutMap;
import io.surfworks.warplayout.inference.CostModel;
import io.surfworks.warplayout.inference.LayoutInference;
import io.surfworks.warplayout.inference.StandardCostModel;
import io.surfworks.warplayout.inference.StandardLayoutInference;
import io.surfworks.warplayout.ir.Function;
import io.surfworks.warplayout.ir.IrPrinter;
import io.surfworks.warplayout.ir.IrVerificationException;
import io.surfworks.warplayout.ir.IrVerifier;
import io.surfworks.warplayout.ir.Module;
import io.surfworks.warplayout.ir.Opcode;
import io.surfworks.warplayout.ir.Operation;
import io.surfworks.warplayout.jfr.LayoutPassEvent;
import io.surfworks.warplayout.jfr.LayoutStageEvent;
import io.surfworks.warplayout.pattern.DotAccumulatorDecomposition;
import io.surfworks.warplayout.pattern.GreedyPatternDriver;
import io.surfworks.warplayout.pattern.PatternApplicationException;
import io.surfworks.warplayout.rewrite.ConvertHoister;
import io.surfworks.warplayout.rewrite.RegionRewriter;
import io.surfworks.warplayout.rewrite.Rematerializer;

/**
 * Removes layout conversions from a module.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@code propagate}: per function, find anchors, propagate their layouts
 *       forward, resolve conflicts and rewrite the function</li>
 *   <li>{@code cleanup}: fold identity conversions, chains of conversions and
 *       conversions of cheap producers</li>
 *   <li>{@code rematerialize}: recompute the source of each remaining conversion
 *       in its target layout where that is cheap</li>
 *   <li>{@code hoist}: move remaining conversions above widening casts and broadcasts</li>
 *   <li>{@code decompose}: split loaded accumulators out of matrix multiplies</li>
 *   <li>{@code final-cleanup}: drop dead loop-carried values and fold conversions again</li>
 * </ol>
 *
 * <p>Rematerialization and hoisting work on a snapshot of the conversions taken
 * when the stage starts; one that cannot be handled stays as it is. A cleanup
 * stage that does not converge, or a verification failure when
 * {@link LayoutPassConfig#verifyEachStage()} is set, ends the run with a failed
 * {@link PassResult}; the IR is then left as the failing stage left it.
 *
 * <p>Example usage:
 * <pre>{@code
 * RemoveLayoutConversionsPass pass = new RemoveLayoutConversionsPass(LayoutPassConfigLoader.load());
 * PassResult result = pass.run(module);
 * if (!result.succeeded()) {
 *     throw new IllegalStateException(result.failedStage() + ": " + result.message());
 * }
 * }</pre>
 */
public final class RemoveLayoutConversionsPass {

    private static final Logger LOG = Logger.getLogger(RemoveLayoutConversionsPass.class.getName());

    private final LayoutPassConfig config;
    private final LayoutInference inference;
    private final CostModel costModel;
    private final IrVerifier verifier = new IrVerifier();

    public RemoveLayoutConversionsPass() {
        this(LayoutPassConfig.defaults());
    }

    /**
     * Creates a pass using the standard oracles. The cost model is built per run
     * from the module's warp geometry, falling back to the configured one.
     */
    public RemoveLayoutConversionsPass(LayoutPassConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.inference = new StandardLayoutInference();
        this.costModel = null;
    }

    /**
     * Creates a pass using the given oracles for every module.
     */
    public RemoveLayoutConversionsPass(LayoutPassConfig config, LayoutInference inference, CostModel costModel) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.inference = Objects.requireNonNull(inference, "inference cannot be null");
        this.costModel = Objects.requireNonNull(costModel, "costModel cannot be null");
    }

    public LayoutPassConfig config() {
        return config;
    }

    public PassResult run(Module module) {
        LayoutPassEvent event = new LayoutPassEvent();
        event.begin();
        CostModel cost = costModel != null
                ? costModel
                : StandardCostModel.forModule(module, config.numWarps(), config.threadsPerWarp());
        Counters counters = new Counters();
        counters.conversionsBefore = countConversions(module);
        LOG.fine("Running on module @" + module.name() + " with " + counters.conversionsBefore + " conversions");

        String stage = "propagate";
        PassResult result;
        try {
            for (Function function : module.functions()) {
                propagate(function, cost, counters);
            }
            counters.conversionsAfterPropagation = countConversions(module);
            finishStage(stage, module, null);

            stage = "cleanup";
            LayoutStageEvent cleanupEvent = beginStage();
            GreedyPatternDriver.conversionCleanup(config.maxPatternIterations()).apply(module);
            finishStage(stage, module, cleanupEvent);

            Rematerializer rematerializer = new Rematerializer(inference, cost);
            if (config.rematerialization()) {
                stage = "rematerialize";
                LayoutStageEvent rematEvent = beginStage();
                for (Operation convert : module.collect(Opcode.CONVERT_LAYOUT)) {
                    if (!convert.isErased() && rematerializer.rematerialize(convert)) {
                        counters.rematerialized++;
                    }
                }
                LOG.fine("Rematerialized " + counters.rematerialized + " conversions");
                finishStage(stage, module, rematEvent);
            }

            if (config.hoisting()) {
                stage = "hoist";
                LayoutStageEvent hoistEvent = beginStage();
                ConvertHoister hoister = new ConvertHoister(inference, rematerializer);
                for (Operation convert : module.collect(Opcode.CONVERT_LAYOUT)) {
                    if (!convert.isErased() && hoister.hoist(convert)) {
                        counters.hoisted++;
                    }
                }
                LOG.fine("Hoisted " + counters.hoisted + " conversions");
                finishStage(stage, module, hoistEvent);
            }

            if (config.dotAccumulatorDecomposition()) {
                stage = "decompose";
                LayoutStageEvent decomposeEvent = beginStage();
                GreedyPatternDriver decompose = new GreedyPatternDriver(config.maxPatternIterations())
                        .addPattern(new DotAccumulatorDecomposition());
                decompose.apply(module);
                counters.decomposed = decompose.lastRewriteCount();
                finishStage(stage, module, decomposeEvent);
            }

            stage = "final-cleanup";
            LayoutStageEvent finalEvent = beginStage();
            GreedyPatternDriver.finalCleanup(config.maxPatternIterations()).apply(module);
            finishStage(stage, module, finalEvent);

            counters.conversionsAfter = countConversions(module);
            result = PassResult.success(counters.toStatistics());
        } catch (PatternApplicationException | IrVerificationException e) {
            LOG.warning("Stage " + stage + " failed on module @" + module.name() + ": " + e.getMessage());
            counters.conversionsAfter = countConversions(module);
            result = PassResult.failure(stage, e.getMessage(), counters.toStatistics());
        }

        event.moduleName = module.name();
        event.functions = counters.functions;
        event.anchors = counters.anchors;
        event.conversionsBefore = counters.conversionsBefore;
        event.conversionsAfter = counters.conversionsAfter;
        event.rematerialized = counters.rematerialized;
        event.hoisted = counters.hoisted;
        event.decomposed = counters.decomposed;
        event.success = result.succeeded();
        event.failedStage = result.failedStage();
        event.commit();

        LOG.fine(String.format("Module @%s: %d -> %d conversions", module.name(),
                counters.conversionsBefore, counters.conversionsAfter));
        return result;
    }

    private void propagate(Function function, CostModel cost, Counters counters) {
        LayoutStageEvent event = beginStage();
        LayoutPropagation propagation = new LayoutPropagation(inference, cost);
        ValueLayoutMap layouts = propagation.analyze(function);
        new RegionRewriter(layouts, inference, cost).rewrite(function);
        counters.functions++;
        counters.anchors += propagation.lastAnchorCount();
        if (config.verifyEachStage()) {
            verifier.check(function);
        }
        event.stage = "propagate";
        event.scope = function.name();
        event.conversionCount = function.collect(Opcode.CONVERT_LAYOUT).size();
        event.commit();
    }

    private static LayoutStageEvent beginStage() {
        LayoutStageEvent event = new LayoutStageEvent();
        event.begin();
        return event;
    }

    /**
     * Verifies and dumps the IR after a module-level stage and commits its event.
     * The per-function propagation stage commits its own events, so {@code event}
     * is null for it.
     */
    private void finishStage(String stage, Module module, LayoutStageEvent event) {
        if (config.verifyEachStage()) {
            verifier.check(module);
        }
        if (config.dumpIr()) {
            LOG.fine("IR after " + stage + ":\n" + IrPrinter.print(module));
        } else if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("IR after " + stage + ":\n" + IrPrinter.print(module));
        }
        if (event != null) {
            event.stage = stage;
            event.scope = module.name();
            event.conversionCount = countConversions(module);
            event.commit();
        }
    }

    static int countConversions(Module module) {
        List<Operation> converts = module.collect(Opcode.CONVERT_LAYOUT);
        return converts.size();
    }

    private static final class Counters {
        int functions;
        int anchors;
        int conversionsBefore;
        int conversionsAfterPropagation;
        int rematerialized;
        int hoisted;
        int decomposed;
        int conversionsAfter;

        PassStatistics toStatistics() {
            return new PassStatistics(functions, anchors, conversionsBefore, conversionsAfterPropagation,
                    rematerialized, hoisted, decomposed, conversionsAfter);
        }
    }
}
