package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.SignalType;

import java.util.Locale;

public record AlertKey(String wallet, String token, SignalType type) {

    public AlertKey {
        wallet = wallet == null ? null : wallet.toLowerCase(Locale.ROOT);
        token = token == null ? null : token.toLowerCase(Locale.ROOT);
    }

    public String asString() {
        return wallet + ":" + token + ":" + type.code();
    }

    @Override
    public String toString() {
        return asString();
    }
}
