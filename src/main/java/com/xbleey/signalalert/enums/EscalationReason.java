package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationReason {
    FIRST_ALERT("first_alert"),
    IMPACT_ESCALATED("impact_escalated"),
    CONFIDENCE_THRESHOLD_CROSSED("confidence_threshold_crossed"),
    LIQUIDITY_WORSENED("liquidity_worsened");

    private final String code;

    EscalationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String whyNowText(int confidenceThresholdPercent) {
        return switch (this) {
            case FIRST_ALERT -> "Why now: First alert for this token";
            case IMPACT_ESCALATED -> "Why now: Impact escalated to High";
            case CONFIDENCE_THRESHOLD_CROSSED ->
                    "Why now: Confidence crossed your " + confidenceThresholdPercent + "% threshold";
            case LIQUIDITY_WORSENED -> "Why now: Liquidity dropped further since last alert";
        };
    }
}
