package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.SignalType;

public record SignalKey(long chainId, String token, SignalType type) {

    public static SignalKey of(TokenRef tokenRef, SignalType type) {
        return new SignalKey(tokenRef.chainId(), tokenRef.address(), type);
    }

    public String asString() {
        return chainId + ":" + token + ":" + type.code();
    }

    @Override
    public String toString() {
        return asString();
    }
}
