package io.surfworks.warplayout.pass;

/**
 * Counters collected over one run of {@link RemoveLayoutConversionsPass}.
 *
 * @param functionsProcessed          functions analyzed and rewritten
 * @param anchorsFound                anchor values over all functions
 * @param conversionsBefore           conversions in the input
 * @param conversionsAfterPropagation conversions after the forward rewrite
 * @param conversionsRematerialized   conversions removed by rematerialization
 * @param conversionsHoisted          conversions moved above a cast or broadcast
 * @param dotAccumulatorsDecomposed   dot accumulators split out
 * @param conversionsAfter            conversions in the output
 */
public record PassStatistics(
        int functionsProcessed,
        int anchorsFound,
        int conversionsBefore,
        int conversionsAfterPropagation,
        int conversionsRematerialized,
        int conversionsHoisted,
        int dotAccumulatorsDecomposed,
        int conversionsAfter
) {

    public static PassStatistics empty() {
        return new PassStatistics(0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Returns the change in the number of conversions, negative when conversions were removed.
     */
    public int conversionDelta() {
        return conversionsAfter - conversionsBefore;
    }
}
