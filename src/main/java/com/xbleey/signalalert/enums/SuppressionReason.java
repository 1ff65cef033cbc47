package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SuppressionReason {
    DUPLICATE("duplicate"),
    COOLDOWN("cooldown");

    private final String code;

    SuppressionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
