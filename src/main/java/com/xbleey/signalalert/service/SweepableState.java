package com.xbleey.signalalert.service;

import java.time.Instant;

public interface SweepableState {

    String stateName();

    int sweep(Instant now);

    int size();
}
