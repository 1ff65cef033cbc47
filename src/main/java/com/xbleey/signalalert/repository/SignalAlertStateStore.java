package com.xbleey.signalalert.repository;

import com.xbleey.signalalert.model.SignalAlertState;

import java.time.Instant;
import java.util.Optional;

public interface SignalAlertStateStore {

    Optional<SignalAlertState> find(String walletAddress, String tokenAddress, String signalType);

    void upsert(SignalAlertState state);

    int deleteIdleBefore(Instant cutoff);

    static SignalAlertStateStore noop() {
        return new SignalAlertStateStore() {
            @Override
            public Optional<SignalAlertState> find(String walletAddress, String tokenAddress, String signalType) {
                return Optional.empty();
            }

            @Override
            public void upsert(SignalAlertState state) {
            }

            @Override
            public int deleteIdleBefore(Instant cutoff) {
                return 0;
            }
        };
    }
}
