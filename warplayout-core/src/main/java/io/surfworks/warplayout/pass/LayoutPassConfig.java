package io.surfworks.warplayout.pass;

import java.nio.file.Path;

/**
 * Configuration for the layout conversion removal pass.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>Values set programmatically through the {@code with*} methods (highest priority)</li>
 *   <li>Config file ({@code ~/.config/warplayout/pass.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * <p>The warp geometry is a fallback: module attributes, when present, override it.
 *
 * @param numWarps                    warps per CTA when the module does not say
 * @param threadsPerWarp              threads per warp when the module does not say
 * @param maxPatternIterations        sweep limit for each cleanup stage
 * @param rematerialization           run backward rematerialization
 * @param hoisting                    run conversion hoisting
 * @param dotAccumulatorDecomposition run the dot accumulator decomposition
 * @param verifyEachStage             verify the IR after every stage
 * @param dumpIr                      log the IR after every stage at FINE
 */
public record LayoutPassConfig(
        int numWarps,
        int threadsPerWarp,
        int maxPatternIterations,
        boolean rematerialization,
        boolean hoisting,
        boolean dotAccumulatorDecomposition,
        boolean verifyEachStage,
        boolean dumpIr
) {

    public static final int DEFAULT_NUM_WARPS = 4;

    public static final int DEFAULT_THREADS_PER_WARP = 32;

    public static final int DEFAULT_MAX_PATTERN_ITERATIONS = 10;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "warplayout"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "pass.json";

    public LayoutPassConfig {
        if (numWarps <= 0) {
            throw new IllegalArgumentException("numWarps must be positive, got " + numWarps);
        }
        if (threadsPerWarp <= 0) {
            throw new IllegalArgumentException("threadsPerWarp must be positive, got " + threadsPerWarp);
        }
        if (maxPatternIterations <= 0) {
            throw new IllegalArgumentException("maxPatternIterations must be positive, got " + maxPatternIterations);
        }
    }

    /**
     * Returns the default configuration: every stage enabled, no verification, no dumps.
     */
    public static LayoutPassConfig defaults() {
        return new LayoutPassConfig(
                DEFAULT_NUM_WARPS,
                DEFAULT_THREADS_PER_WARP,
                DEFAULT_MAX_PATTERN_ITERATIONS,
                true,
                true,
                true,
                false,
                false
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public LayoutPassConfig withWarpGeometry(int warps, int threads) {
        return new LayoutPassConfig(warps, threads, maxPatternIterations, rematerialization,
                hoisting, dotAccumulatorDecomposition, verifyEachStage, dumpIr);
    }

    public LayoutPassConfig withMaxPatternIterations(int iterations) {
        return new LayoutPassConfig(numWarps, threadsPerWarp, iterations, rematerialization,
                hoisting, dotAccumulatorDecomposition, verifyEachStage, dumpIr);
    }

    public LayoutPassConfig withRematerialization(boolean enabled) {
        return new LayoutPassConfig(numWarps, threadsPerWarp, maxPatternIterations, enabled,
                hoisting, dotAccumulatorDecomposition, verifyEachStage, dumpIr);
    }

    public LayoutPassConfig withHoisting(boolean enabled) {
        return new LayoutPassConfig(numWarps, threadsPerWarp, maxPatternIterations, rematerialization,
                enabled, dotAccumulatorDecomposition, verifyEachStage, dumpIr);
    }

    public LayoutPassConfig withDotAccumulatorDecomposition(boolean enabled) {
        return new LayoutPassConfig(numWarps, threadsPerWarp, maxPatternIterations, rematerialization,
                hoisting, enabled, verifyEachStage, dumpIr);
    }

    public LayoutPassConfig withVerifyEachStage(boolean enabled) {
        return new LayoutPassConfig(numWarps, threadsPerWarp, maxPatternIterations, rematerialization,
                hoisting, dotAccumulatorDecomposition, enabled, dumpIr);
    }

    public LayoutPassConfig withDumpIr(boolean enabled) {
        return new LayoutPassConfig(numWarps, threadsPerWarp, maxPatternIterations, rematerialization,
                hoisting, dotAccumulatorDecomposition, verifyEachStage, enabled);
    }
}
