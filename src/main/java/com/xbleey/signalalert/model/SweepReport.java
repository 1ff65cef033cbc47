package com.xbleey.signalalert.model;

import java.time.Instant;
import java.util.Map;

public record SweepReport(Instant ranAt, Map<String, Integer> removed, Map<String, Integer> remaining) {

    public int totalRemoved() {
        return removed.values().stream().mapToInt(Integer::intValue).sum();
    }
}
