package com.assuranceledger.ledger;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for largest-remainder allocation.
 */
class AllocationPlannerTest {

    @Test
    void testEvenSplit() {
        List<AllocationLine> lines = AllocationPlanner.proportional(4000, AllocationType.MILESTONE_RELEASE, "m-1",
            List.of(new AllocationPlanner.WeightedTarget("o-1", 1), new AllocationPlanner.WeightedTarget("o-2", 1)));

        assertEquals(2, lines.size());
        assertEquals(2000, lines.get(0).getAmount());
        assertEquals(2000, lines.get(1).getAmount());
        assertEquals("o-1", lines.get(0).getObligationId());
        assertEquals("m-1", lines.get(1).getMilestoneId());
    }

    @Test
    void testLeftoverGoesToLargestRemainders() {
        // 100 over weights 1:1:1 -> 33.33 each, the single leftover unit goes to the first target
        List<AllocationLine> lines = AllocationPlanner.proportional(100, AllocationType.MILESTONE_RELEASE, "m-1",
            List.of(new AllocationPlanner.WeightedTarget("o-1", 1),
                new AllocationPlanner.WeightedTarget("o-2", 1),
                new AllocationPlanner.WeightedTarget("o-3", 1)));

        assertEquals(34, lines.get(0).getAmount());
        assertEquals(33, lines.get(1).getAmount());
        assertEquals(33, lines.get(2).getAmount());
    }

    @Test
    void testWeightedSplitSumsToAmount() {
        // 1001 over 3:2 -> 600.6 and 400.4; the leftover unit goes to the .6 remainder
        List<AllocationLine> lines = AllocationPlanner.proportional(1001, AllocationType.FORFEIT, null,
            List.of(new AllocationPlanner.WeightedTarget("o-1", 3), new AllocationPlanner.WeightedTarget("o-2", 2)));

        assertEquals(601, lines.get(0).getAmount());
        assertEquals(400, lines.get(1).getAmount());
        assertEquals(1001, lines.stream().mapToLong(AllocationLine::getAmount).sum());
    }

    @Test
    void testZeroSharesAreDropped() {
        List<AllocationLine> lines = AllocationPlanner.proportional(1, AllocationType.MILESTONE_RELEASE, "m-1",
            List.of(new AllocationPlanner.WeightedTarget("o-1", 1), new AllocationPlanner.WeightedTarget("o-2", 1)));

        assertEquals(1, lines.size());
        assertEquals("o-1", lines.get(0).getObligationId());
    }

    @Test
    void testNoTargetsAllocatesToMilestone() {
        List<AllocationLine> lines = AllocationPlanner.proportional(500, AllocationType.MILESTONE_RELEASE, "m-1",
            List.of());

        assertEquals(1, lines.size());
        assertEquals(500, lines.get(0).getAmount());
        assertNull(lines.get(0).getObligationId());
        assertEquals("m-1", lines.get(0).getMilestoneId());
    }
}
