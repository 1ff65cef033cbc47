package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum ImpactLevel {
    LOW("low", "Low", 0),
    MEDIUM("medium", "Medium", 40),
    HIGH("high", "High", 70);

    private final String code;
    private final String label;
    private final int minScore;

    ImpactLevel(String code, String label, int minScore) {
        this.code = code;
        this.label = label;
        this.minScore = minScore;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isHigherThan(ImpactLevel other) {
        return other == null || ordinal() > other.ordinal();
    }

    public static ImpactLevel fromScore(int score) {
        if (score >= HIGH.minScore) {
            return HIGH;
        }
        if (score >= MEDIUM.minScore) {
            return MEDIUM;
        }
        return LOW;
    }

    public static ImpactLevel fromCode(String code) {
        for (ImpactLevel level : values()) {
            if (level.code.equalsIgnoreCase(code)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown impact level: " + code);
    }
}
