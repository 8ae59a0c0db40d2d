package com.policywatch.ingest.polish;

/**
 * @param text    polished text, or the original draft for every outcome other than POLISHED
 * @param outcome what happened
 */
public record PolishResult(String text, PolishOutcome outcome) {

    static PolishResult keep(String draft, PolishOutcome outcome) {
        return new PolishResult(draft, outcome);
    }

    public boolean isPolished() {
        return outcome == PolishOutcome.POLISHED;
    }
}
