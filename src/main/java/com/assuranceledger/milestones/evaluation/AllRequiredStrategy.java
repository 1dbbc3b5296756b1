package com.assuranceledger.milestones.evaluation;

import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.Milestone;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ready when every required link is satisfied. Non-required links are advisory.
 */
@Component
public class AllRequiredStrategy implements EvaluationStrategy {

    @Override
    public EvaluationResult evaluate(Milestone milestone, List<LinkedObligation> links) {
        long required = links.stream().filter(LinkedObligation::isRequired).count();
        long satisfied = links.stream()
            .filter(LinkedObligation::isRequired)
            .filter(LinkedObligation::isSatisfied)
            .count();

        if (required == 0) {
            return EvaluationResult.pending(0, 0, "No required obligations linked");
        }
        if (satisfied < required) {
            return EvaluationResult.pending(satisfied, required,
                String.format("%d of %d required obligations satisfied", satisfied, required));
        }
        return EvaluationResult.ready(satisfied, required, "All required obligations satisfied");
    }

    @Override
    public EvaluationMode getMode() {
        return EvaluationMode.ALL;
    }
}
