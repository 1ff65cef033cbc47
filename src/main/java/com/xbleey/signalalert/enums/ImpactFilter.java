package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum ImpactFilter {
    HIGH("high", ImpactLevel.HIGH),
    HIGH_AND_MEDIUM("high+medium", ImpactLevel.MEDIUM),
    ALL("all", ImpactLevel.LOW);

    private final String code;
    private final ImpactLevel lowestAccepted;

    ImpactFilter(String code, ImpactLevel lowestAccepted) {
        this.code = code;
        this.lowestAccepted = lowestAccepted;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean accepts(ImpactLevel level) {
        return level != null && level.ordinal() >= lowestAccepted.ordinal();
    }

    @JsonCreator
    public static ImpactFilter fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ImpactFilter filter : values()) {
            if (filter.code.equalsIgnoreCase(code.trim()) || filter.name().equalsIgnoreCase(code.trim())) {
                return filter;
            }
        }
        throw new IllegalArgumentException("Unknown impact filter: " + code);
    }
}
