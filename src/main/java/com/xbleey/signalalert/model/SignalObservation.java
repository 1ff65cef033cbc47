package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.RiskFactor;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.enums.SignalType;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record SignalObservation(
        TokenRef token,
        SignalType type,
        SignalSeverity severity,
        double confidence,
        ImpactScore impact,
        List<RiskFactor> riskFactors,
        boolean honeypot,
        Double liquidityDropPercent,
        Double liquidityUsd
) {

    public SignalObservation {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }

    public SignalKey key() {
        return SignalKey.of(token, type);
    }

    public int confidencePercent() {
        return (int) Math.round(confidence * 100);
    }

    public Map<String, Object> fingerprintAttributes() {
        Map<String, Object> attributes = new TreeMap<>();
        if (type == SignalType.RISK) {
            attributes.put("factors", riskFactors.stream().map(RiskFactor::code).sorted().toList());
        } else {
            attributes.put("dropPct", liquidityDropPercent);
        }
        attributes.put("severity", severity.code());
        attributes.put("confidence", confidence);
        return attributes;
    }
}
