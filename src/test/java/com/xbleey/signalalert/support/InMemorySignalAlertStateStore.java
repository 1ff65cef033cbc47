package com.xbleey.signalalert.support;

import com.xbleey.signalalert.model.SignalAlertState;
import com.xbleey.signalalert.repository.SignalAlertStateStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySignalAlertStateStore implements SignalAlertStateStore {

    private final Map<String, SignalAlertState> rows = new ConcurrentHashMap<>();
    private boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public Optional<SignalAlertState> row(String walletAddress, String tokenAddress, String signalType) {
        return Optional.ofNullable(rows.get(key(walletAddress, tokenAddress, signalType)));
    }

    public int rowCount() {
        return rows.size();
    }

    @Override
    public Optional<SignalAlertState> find(String walletAddress, String tokenAddress, String signalType) {
        checkAvailable();
        return row(walletAddress, tokenAddress, signalType);
    }

    @Override
    public void upsert(SignalAlertState state) {
        checkAvailable();
        rows.put(key(state.getWalletAddress(), state.getTokenAddress(), state.getSignalType()), state);
    }

    @Override
    public int deleteIdleBefore(Instant cutoff) {
        checkAvailable();
        int before = rows.size();
        rows.values().removeIf(row -> row.getLastAlertAt().isBefore(cutoff));
        return before - rows.size();
    }

    private void checkAvailable() {
        if (failing) {
            throw new IllegalStateException("db down");
        }
    }

    private static String key(String walletAddress, String tokenAddress, String signalType) {
        return walletAddress + ":" + tokenAddress + ":" + signalType;
    }
}
