package com.xbleey.signalalert.repository;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.xbleey.signalalert.mapper.TelegramSubscriptionMapper;
import com.xbleey.signalalert.model.TelegramSubscription;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
public class MyBatisPlusSubscriptionStore implements SubscriptionStore {

    private final TelegramSubscriptionMapper mapper;

    public MyBatisPlusSubscriptionStore(TelegramSubscriptionMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<TelegramSubscription> findByWallet(String walletAddress) {
        if (walletAddress == null || walletAddress.isBlank()) {
            return Optional.empty();
        }
        LambdaQueryWrapper<TelegramSubscription> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(TelegramSubscription::getWalletAddress, walletAddress.trim().toLowerCase(Locale.ROOT))
                .last("limit 1");
        return Optional.ofNullable(mapper.selectOne(wrapper));
    }

    @Override
    public int update(TelegramSubscription subscription) {
        return mapper.updateById(subscription);
    }

    @Override
    public boolean updateEnabled(String walletAddress, boolean enabled) {
        if (walletAddress == null || walletAddress.isBlank()) {
            return false;
        }
        LambdaUpdateWrapper<TelegramSubscription> wrapper = new LambdaUpdateWrapper<>();
        wrapper.eq(TelegramSubscription::getWalletAddress, walletAddress.trim().toLowerCase(Locale.ROOT))
                .set(TelegramSubscription::getEnabled, enabled);
        return mapper.update(null, wrapper) > 0;
    }
}
