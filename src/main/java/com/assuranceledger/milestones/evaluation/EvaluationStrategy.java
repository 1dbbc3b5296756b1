package com.assuranceledger.milestones.evaluation;

import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.Milestone;

import java.util.List;

/**
 * Interface for milestone evaluation strategies.
 *
 * Each strategy scores a milestone against the current state of its linked obligations and
 * decides whether the milestone is ready for release. Strategies must not read anything
 * besides their arguments.
 */
public interface EvaluationStrategy {

    /**
     * Evaluate a milestone against its links.
     *
     * @param milestone the milestone to evaluate
     * @param links the milestone's links joined with the current obligation status
     * @return whether the milestone is ready, and why
     */
    EvaluationResult evaluate(Milestone milestone, List<LinkedObligation> links);

    /**
     * The evaluation mode this strategy implements.
     */
    EvaluationMode getMode();
}
