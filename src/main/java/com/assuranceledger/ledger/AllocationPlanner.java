package com.assuranceledger.ledger;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits an amount across weighted targets.
 *
 * Uses the largest-remainder method: every target gets {@code floor(amount * w / W)} and the
 * leftover minor units go one at a time to the largest fractional remainders, earlier targets
 * winning ties. The shares always sum to exactly {@code amount}; zero shares are dropped.
 */
public final class AllocationPlanner {

    private AllocationPlanner() {
    }

    public static List<AllocationLine> proportional(long amount, AllocationType type, String milestoneId,
                                                    List<WeightedTarget> targets) {
        if (targets.isEmpty()) {
            return List.of(AllocationLine.toMilestone(type, milestoneId, amount));
        }
        long totalWeight = targets.stream().mapToLong(WeightedTarget::getWeight).sum();
        if (totalWeight <= 0) {
            throw new IllegalArgumentException("Total weight must be positive");
        }

        long[] shares = new long[targets.size()];
        long[] remainders = new long[targets.size()];
        long assigned = 0;
        for (int i = 0; i < targets.size(); i++) {
            long numerator = Math.multiplyExact(amount, targets.get(i).getWeight());
            shares[i] = numerator / totalWeight;
            remainders[i] = numerator % totalWeight;
            assigned += shares[i];
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingLong((Integer i) -> remainders[i]).reversed()
            .thenComparingInt(i -> i));
        long leftover = amount - assigned;
        for (int k = 0; k < leftover; k++) {
            shares[order.get(k % order.size())]++;
        }

        List<AllocationLine> lines = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            if (shares[i] > 0) {
                lines.add(AllocationLine.builder()
                    .allocationType(type)
                    .obligationId(targets.get(i).getObligationId())
                    .milestoneId(milestoneId)
                    .amount(shares[i])
                    .build());
            }
        }
        return lines;
    }

    /**
     * An obligation and its link weight.
     */
    @Value
    public static class WeightedTarget {
        String obligationId;
        long weight;
    }
}
