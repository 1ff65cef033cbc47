package com.xbleey.signalalert.repository;

import com.xbleey.signalalert.model.SignalAlertHistory;

public interface SignalAlertHistoryStore {

    SignalAlertHistory save(SignalAlertHistory record);

    static SignalAlertHistoryStore noop() {
        return record -> record;
    }
}
