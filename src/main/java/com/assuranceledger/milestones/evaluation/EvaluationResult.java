package com.assuranceledger.milestones.evaluation;

import lombok.Value;

/**
 * Result of a milestone evaluation.
 */
@Value
public class EvaluationResult {
    boolean ready;
    long satisfied;
    long required;
    String reason;

    public static EvaluationResult ready(long satisfied, long required, String reason) {
        return new EvaluationResult(true, satisfied, required, reason);
    }

    public static EvaluationResult pending(long satisfied, long required, String reason) {
        return new EvaluationResult(false, satisfied, required, reason);
    }
}
