package com.xbleey.signalalert.repository;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.xbleey.signalalert.mapper.SignalAlertStateMapper;
import com.xbleey.signalalert.model.SignalAlertState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Component
public class MyBatisPlusSignalAlertStateStore implements SignalAlertStateStore {

    private final SignalAlertStateMapper mapper;

    public MyBatisPlusSignalAlertStateStore(SignalAlertStateMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<SignalAlertState> find(String walletAddress, String tokenAddress, String signalType) {
        LambdaQueryWrapper<SignalAlertState> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(SignalAlertState::getWalletAddress, walletAddress)
                .eq(SignalAlertState::getTokenAddress, tokenAddress)
                .eq(SignalAlertState::getSignalType, signalType)
                .last("limit 1");
        return Optional.ofNullable(mapper.selectOne(wrapper));
    }

    @Override
    public void upsert(SignalAlertState state) {
        Optional<SignalAlertState> existing = find(state.getWalletAddress(), state.getTokenAddress(), state.getSignalType());
        if (existing.isPresent()) {
            state.setId(existing.get().getId());
            mapper.updateById(state);
            return;
        }
        mapper.insert(state);
    }

    @Override
    public int deleteIdleBefore(Instant cutoff) {
        LambdaQueryWrapper<SignalAlertState> wrapper = new LambdaQueryWrapper<>();
        wrapper.lt(SignalAlertState::getLastAlertAt, cutoff);
        return mapper.delete(wrapper);
    }
}
