package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum SignalType {
    RISK("risk", "Risk"),
    LIQUIDITY("liquidity", "Liquidity");

    private final String code;
    private final String label;

    SignalType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static SignalType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("signal type must not be null");
        }
        for (SignalType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown signal type: " + code);
    }
}
