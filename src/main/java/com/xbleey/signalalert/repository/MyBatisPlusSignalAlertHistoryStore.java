package com.xbleey.signalalert.repository;

import com.xbleey.signalalert.mapper.SignalAlertHistoryMapper;
import com.xbleey.signalalert.model.SignalAlertHistory;
import org.springframework.stereotype.Component;

@Component
public class MyBatisPlusSignalAlertHistoryStore implements SignalAlertHistoryStore {

    private final SignalAlertHistoryMapper mapper;

    public MyBatisPlusSignalAlertHistoryStore(SignalAlertHistoryMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public SignalAlertHistory save(SignalAlertHistory record) {
        mapper.insert(record);
        return record;
    }
}
