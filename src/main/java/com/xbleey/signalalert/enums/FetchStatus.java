package com.xbleey.signalalert.enums;

public enum FetchStatus {
    OK,
    DEGRADED,
    UNAVAILABLE
}
