package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

// Declaration order is the severity order.
@Getter
public enum SignalSeverity {
    WARNING("warning"),
    DANGER("danger"),
    CRITICAL("critical");

    private final String code;

    SignalSeverity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isHigherThan(SignalSeverity other) {
        return other == null || ordinal() > other.ordinal();
    }

    public static SignalSeverity fromCode(String code) {
        for (SignalSeverity severity : values()) {
            if (severity.code.equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + code);
    }
}
