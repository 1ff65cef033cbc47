package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecurrenceTrend {
    NEW,
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
