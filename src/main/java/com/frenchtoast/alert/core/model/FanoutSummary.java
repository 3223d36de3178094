package com.frenchtoast.alert.core.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-outcome counts of one bulk delivery pass.
 */
public record FanoutSummary(Map<DeliveryOutcome, Integer> counts) {

    public static FanoutSummary of(List<DeliveryOutcome> outcomes) {
        Map<DeliveryOutcome, Integer> counts = new EnumMap<>(DeliveryOutcome.class);
        for (DeliveryOutcome o : DeliveryOutcome.values()) {
            counts.put(o, 0);
        }
        for (DeliveryOutcome o : outcomes) {
            counts.merge(o, 1, Integer::sum);
        }
        return new FanoutSummary(counts);
    }

    public static FanoutSummary empty() {
        return of(List.of());
    }

    public int count(DeliveryOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int attempted() {
        return count(DeliveryOutcome.DELIVERED) + count(DeliveryOutcome.DEACTIVATED) + count(DeliveryOutcome.FAILED);
    }
}
