package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.RiskFactor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public record RiskFacts(List<RiskFactor> factors, boolean honeypot) {

    public RiskFacts {
        List<RiskFactor> normalized = new ArrayList<>();
        if (factors != null) {
            for (RiskFactor factor : factors) {
                if (factor != null && !normalized.contains(factor)) {
                    normalized.add(factor);
                }
            }
        }
        if (honeypot && !normalized.contains(RiskFactor.HONEYPOT)) {
            normalized.add(RiskFactor.HONEYPOT);
        }
        if (normalized.contains(RiskFactor.HONEYPOT)) {
            honeypot = true;
        }
        normalized.sort(Comparator.naturalOrder());
        factors = List.copyOf(normalized);
    }

    public static RiskFacts none() {
        return new RiskFacts(List.of(), false);
    }

    public boolean hasFactors() {
        return !factors.isEmpty();
    }

    public boolean hasOwnershipControl() {
        return factors.stream().anyMatch(RiskFactor::isOwnershipControl);
    }

    public boolean hasCriticalFactor() {
        return factors.stream().anyMatch(RiskFactor::isCritical);
    }
}
