package io.surfworks.warplayout.pass;

import java.util.Objects;

/**
 * Outcome of one run of {@link RemoveLayoutConversionsPass}.
 *
 * @param succeeded   whether every stage completed
 * @param failedStage the stage that failed, or null
 * @param message     the failure message, or null
 * @param statistics  counters collected up to the end of the run or the failure
 */
public record PassResult(boolean succeeded, String failedStage, String message, PassStatistics statistics) {

    public PassResult {
        Objects.requireNonNull(statistics, "statistics cannot be null");
        if (!succeeded) {
            Objects.requireNonNull(failedStage, "failedStage cannot be null for a failure");
        }
    }

    public static PassResult success(PassStatistics statistics) {
        return new PassResult(true, null, null, statistics);
    }

    public static PassResult failure(String stage, String message, PassStatistics statistics) {
        return new PassResult(false, stage, message, statistics);
    }
}
