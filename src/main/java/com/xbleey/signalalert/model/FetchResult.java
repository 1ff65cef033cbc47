package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.FetchStatus;

public record FetchResult<T>(FetchStatus status, T data, String reason) {

    public static <T> FetchResult<T> ok(T data) {
        return new FetchResult<>(FetchStatus.OK, data, null);
    }

    public static <T> FetchResult<T> degraded(T data, String reason) {
        return new FetchResult<>(FetchStatus.DEGRADED, data, reason);
    }

    public static <T> FetchResult<T> unavailable(String reason) {
        return new FetchResult<>(FetchStatus.UNAVAILABLE, null, reason);
    }

    public boolean hasData() {
        return status != FetchStatus.UNAVAILABLE && data != null;
    }

    public FetchResult<T> degrade(String degradedReason) {
        if (status == FetchStatus.UNAVAILABLE) {
            return this;
        }
        return new FetchResult<>(FetchStatus.DEGRADED, data, degradedReason);
    }
}
