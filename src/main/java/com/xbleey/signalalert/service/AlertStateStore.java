package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.SignalSuppressionProperties;
import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.model.AlertKey;
import com.xbleey.signalalert.model.AlertState;
import com.xbleey.signalalert.model.SignalAlertState;
import com.xbleey.signalalert.repository.SignalAlertStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class AlertStateStore implements SweepableState {

    private static final Logger log = LoggerFactory.getLogger(AlertStateStore.class);

    private final Map<AlertKey, AlertState> states = new ConcurrentHashMap<>();
    private final SignalSuppressionProperties properties;
    private final SignalAlertStateStore persistentStore;

    public AlertStateStore(SignalSuppressionProperties properties) {
        this(properties, SignalAlertStateStore.noop());
    }

    @Autowired
    public AlertStateStore(SignalSuppressionProperties properties, SignalAlertStateStore persistentStore) {
        this.properties = properties;
        this.persistentStore = persistentStore == null ? SignalAlertStateStore.noop() : persistentStore;
    }

    public Optional<AlertState> find(AlertKey key) {
        AlertState cached = states.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<AlertState> loaded = load(key);
        return loaded.map(state -> {
            AlertState existing = states.putIfAbsent(key, state);
            return existing == null ? state : existing;
        });
    }

    // In process only until commit.
    Optional<AlertState> reserve(AlertKey key, AlertState state) {
        return Optional.ofNullable(states.put(key, state));
    }

    void release(AlertKey key, AlertState reserved, AlertState previous) {
        if (previous == null) {
            states.remove(key, reserved);
        } else {
            states.replace(key, reserved, previous);
        }
    }

    void commit(AlertKey key, AlertState state) {
        try {
            persistentStore.upsert(toRecord(key, state));
        } catch (Exception ex) {
            log.warn("Failed to persist alert state for {}", key, ex);
        }
        log.info("Updated alert state for {}: impact={} confidence={}",
                key, state.lastImpact().code(), state.lastConfidence());
    }

    public void save(AlertKey key, AlertState state) {
        states.put(key, state);
        commit(key, state);
    }

    @Override
    public String stateName() {
        return "alertState";
    }

    @Override
    public int sweep(Instant now) {
        Instant cutoff = now.minus(properties.getAlertStateRetention());
        int removed = 0;
        for (Map.Entry<AlertKey, AlertState> entry : states.entrySet()) {
            if (entry.getValue().lastAlertAt().isBefore(cutoff) && states.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        try {
            int deleted = persistentStore.deleteIdleBefore(cutoff);
            if (deleted > 0) {
                log.info("Deleted {} idle persisted alert states", deleted);
            }
        } catch (Exception ex) {
            log.warn("Failed to delete idle persisted alert states", ex);
        }
        return removed;
    }

    @Override
    public int size() {
        return states.size();
    }

    private Optional<AlertState> load(AlertKey key) {
        try {
            return persistentStore.find(key.wallet(), key.token(), key.type().code()).map(AlertStateStore::toState);
        } catch (Exception ex) {
            log.warn("Failed to load alert state for {}", key, ex);
            return Optional.empty();
        }
    }

    private static SignalAlertState toRecord(AlertKey key, AlertState state) {
        SignalAlertState record = new SignalAlertState();
        record.setWalletAddress(key.wallet());
        record.setTokenAddress(key.token());
        record.setSignalType(key.type().code());
        record.setLastImpact(state.lastImpact().code());
        record.setLastConfidence(BigDecimal.valueOf(state.lastConfidence()));
        if (state.lastLiquidityDrop() != null) {
            record.setLastLiquidityDrop(BigDecimal.valueOf(state.lastLiquidityDrop()));
        }
        record.setLastAlertAt(state.lastAlertAt());
        record.setUpdatedAt(state.lastAlertAt());
        return record;
    }

    private static AlertState toState(SignalAlertState record) {
        return new AlertState(
                ImpactLevel.fromCode(record.getLastImpact()),
                record.getLastConfidence().doubleValue(),
                record.getLastLiquidityDrop() == null ? null : record.getLastLiquidityDrop().doubleValue(),
                record.getLastAlertAt()
        );
    }
}
