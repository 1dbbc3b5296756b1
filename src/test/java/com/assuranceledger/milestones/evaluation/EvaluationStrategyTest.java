package com.assuranceledger.milestones.evaluation;

import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.ReleaseMode;
import com.assuranceledger.milestones.ThresholdCounting;
import com.assuranceledger.obligations.ObligationStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the milestone evaluation strategies.
 */
class EvaluationStrategyTest {

    private final AllRequiredStrategy all = new AllRequiredStrategy();
    private final AnyRequiredStrategy any = new AnyRequiredStrategy();
    private final ThresholdStrategy threshold = new ThresholdStrategy();

    @Test
    void testAllRequiresEveryRequiredLink() {
        Milestone milestone = milestone(EvaluationMode.ALL, null, null);

        assertFalse(all.evaluate(milestone, List.of(
            link("o-1", 1, true, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.IN_PROGRESS))).isReady());

        EvaluationResult result = all.evaluate(milestone, List.of(
            link("o-1", 1, true, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.SATISFIED),
            link("o-3", 1, false, ObligationStatus.PENDING)));
        assertTrue(result.isReady());
        assertEquals(2, result.getSatisfied());
        assertEquals(2, result.getRequired());
    }

    @Test
    void testAllWithoutRequiredLinksIsNeverReady() {
        Milestone milestone = milestone(EvaluationMode.ALL, null, null);

        assertFalse(all.evaluate(milestone, List.of()).isReady());
        assertFalse(all.evaluate(milestone, List.of(
            link("o-1", 1, false, ObligationStatus.SATISFIED))).isReady());
    }

    @Test
    void testWaivedAndBreachedNeverCount() {
        Milestone milestone = milestone(EvaluationMode.ALL, null, null);

        assertFalse(all.evaluate(milestone, List.of(
            link("o-1", 1, true, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.WAIVED))).isReady());
        assertFalse(any.evaluate(milestone(EvaluationMode.ANY, null, null), List.of(
            link("o-1", 1, true, ObligationStatus.BREACHED),
            link("o-2", 1, true, ObligationStatus.EXPIRED))).isReady());
    }

    @Test
    void testAnyNeedsOneSatisfiedRequiredLink() {
        Milestone milestone = milestone(EvaluationMode.ANY, null, null);

        assertFalse(any.evaluate(milestone, List.of(
            link("o-1", 1, false, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.PENDING))).isReady());
        assertTrue(any.evaluate(milestone, List.of(
            link("o-1", 1, false, ObligationStatus.PENDING),
            link("o-2", 1, true, ObligationStatus.SATISFIED))).isReady());
    }

    @Test
    void testThresholdReadyAtSecondSatisfaction() {
        Milestone milestone = milestone(EvaluationMode.THRESHOLD, 2, null);

        assertFalse(threshold.evaluate(milestone, List.of(
            link("o-1", 1, true, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.PENDING),
            link("o-3", 1, true, ObligationStatus.PENDING))).isReady());

        EvaluationResult result = threshold.evaluate(milestone, List.of(
            link("o-1", 1, true, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.SATISFIED),
            link("o-3", 1, true, ObligationStatus.PENDING)));
        assertTrue(result.isReady());
        assertEquals(2, result.getSatisfied());
    }

    @Test
    void testThresholdCountsWeightsByDefault() {
        Milestone milestone = milestone(EvaluationMode.THRESHOLD, 3, null);
        List<LinkedObligation> links = List.of(
            link("o-1", 3, false, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.PENDING));

        assertEquals(ThresholdCounting.WEIGHT_SUM, threshold.getDefaultCounting());
        assertTrue(threshold.evaluate(milestone, links).isReady());

        // Counting obligations instead: one satisfied link is below 3
        Milestone byCount = milestone(EvaluationMode.THRESHOLD, 3, ThresholdCounting.OBLIGATION_COUNT);
        assertFalse(threshold.evaluate(byCount, links).isReady());
    }

    @Test
    void testEvaluationIsPure() {
        Milestone milestone = milestone(EvaluationMode.THRESHOLD, 2, null);
        List<LinkedObligation> links = List.of(
            link("o-1", 1, true, ObligationStatus.SATISFIED),
            link("o-2", 1, true, ObligationStatus.SATISFIED));

        EvaluationResult first = threshold.evaluate(milestone, links);
        EvaluationResult second = threshold.evaluate(milestone, links);

        assertEquals(first, second);
        assertNull(milestone.getReadyAt());
    }

    private static Milestone milestone(EvaluationMode mode, Integer minSatisfied, ThresholdCounting counting) {
        return new Milestone("tenant-1", "contract-1", "m", "Milestone", mode, minSatisfied, counting,
            ReleaseMode.MANUAL, 1000, null, 0);
    }

    private static LinkedObligation link(String obligationId, long weight, boolean required, ObligationStatus status) {
        return new LinkedObligation(obligationId, weight, required, status);
    }
}
