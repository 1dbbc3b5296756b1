package com.assuranceledger.milestones.evaluation;

import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.Milestone;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ready when at least one required link is satisfied.
 */
@Component
public class AnyRequiredStrategy implements EvaluationStrategy {

    @Override
    public EvaluationResult evaluate(Milestone milestone, List<LinkedObligation> links) {
        long satisfied = links.stream()
            .filter(LinkedObligation::isRequired)
            .filter(LinkedObligation::isSatisfied)
            .count();

        if (satisfied == 0) {
            return EvaluationResult.pending(0, 1, "No required obligation satisfied yet");
        }
        return EvaluationResult.ready(satisfied, 1,
            String.format("%d required obligation(s) satisfied", satisfied));
    }

    @Override
    public EvaluationMode getMode() {
        return EvaluationMode.ANY;
    }
}
