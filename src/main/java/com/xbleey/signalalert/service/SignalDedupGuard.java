package com.xbleey.signalalert.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.config.SignalSuppressionProperties;
import com.xbleey.signalalert.model.DedupFingerprint;
import com.xbleey.signalalert.model.SignalKey;
import com.xbleey.signalalert.model.SignalObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class SignalDedupGuard implements SweepableState {

    private static final Logger log = LoggerFactory.getLogger(SignalDedupGuard.class);
    private static final int HASH_LENGTH = 16;

    private final Map<SignalKey, DedupFingerprint> fingerprints = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final SignalSuppressionProperties properties;
    private final Clock clock;

    public SignalDedupGuard(ObjectMapper objectMapper, SignalSuppressionProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isDuplicate(SignalObservation observation) {
        return isDuplicate(observation.key(), fingerprint(observation));
    }

    // A hit keeps the stored fingerprint, a miss replaces it.
    public boolean isDuplicate(SignalKey key, String fingerprint) {
        Instant now = clock.instant();
        boolean[] duplicate = new boolean[1];
        fingerprints.compute(key, (ignored, current) -> {
            if (current != null && current.isActive(now) && current.hash().equals(fingerprint)) {
                duplicate[0] = true;
                return current;
            }
            return new DedupFingerprint(fingerprint, now, now.plus(properties.getDedupWindow()));
        });
        if (duplicate[0]) {
            log.debug("Duplicate signal state for {} ({})", key, fingerprint);
        }
        return duplicate[0];
    }

    public Optional<DedupFingerprint> status(SignalKey key) {
        DedupFingerprint current = fingerprints.get(key);
        if (current == null || !current.isActive(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    public String fingerprint(SignalObservation observation) {
        return hash(new TreeMap<>(observation.fingerprintAttributes()));
    }

    String hash(Map<String, Object> attributes) {
        String canonical;
        try {
            canonical = objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize fingerprint attributes", ex);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    @Override
    public String stateName() {
        return "signalDedup";
    }

    @Override
    public int sweep(Instant now) {
        int removed = 0;
        for (Map.Entry<SignalKey, DedupFingerprint> entry : fingerprints.entrySet()) {
            if (!entry.getValue().isActive(now) && fingerprints.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return fingerprints.size();
    }
}
