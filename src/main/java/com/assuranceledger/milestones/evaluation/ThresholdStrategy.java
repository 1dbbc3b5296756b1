package com.assuranceledger.milestones.evaluation;

import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.ThresholdCounting;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ready when the satisfied links reach the milestone's {@code minSatisfiedCount}.
 *
 * Every link counts, required or not. What is counted is the milestone's own
 * {@link ThresholdCounting} if set, otherwise the configured default.
 */
@Component
public class ThresholdStrategy implements EvaluationStrategy {

    @Value("${assurance-ledger.evaluation.threshold-counting:WEIGHT_SUM}")
    private ThresholdCounting defaultCounting = ThresholdCounting.WEIGHT_SUM;

    @Override
    public EvaluationResult evaluate(Milestone milestone, List<LinkedObligation> links) {
        ThresholdCounting counting = milestone.getThresholdCounting() != null
            ? milestone.getThresholdCounting()
            : defaultCounting;
        long minimum = milestone.getMinSatisfiedCount() != null ? milestone.getMinSatisfiedCount() : 1;

        long satisfied = links.stream()
            .filter(LinkedObligation::isSatisfied)
            .mapToLong(link -> counting == ThresholdCounting.WEIGHT_SUM ? link.getWeight() : 1)
            .sum();

        if (satisfied < minimum) {
            return EvaluationResult.pending(satisfied, minimum,
                String.format("Satisfied %s %d below threshold %d", counting, satisfied, minimum));
        }
        return EvaluationResult.ready(satisfied, minimum,
            String.format("Satisfied %s %d reached threshold %d", counting, satisfied, minimum));
    }

    @Override
    public EvaluationMode getMode() {
        return EvaluationMode.THRESHOLD;
    }

    public ThresholdCounting getDefaultCounting() {
        return defaultCounting;
    }
}
