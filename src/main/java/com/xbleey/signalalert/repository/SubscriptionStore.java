package com.xbleey.signalalert.repository;

import com.xbleey.signalalert.model.TelegramSubscription;

import java.util.Optional;

public interface SubscriptionStore {

    Optional<TelegramSubscription> findByWallet(String walletAddress);

    int update(TelegramSubscription subscription);

    boolean updateEnabled(String walletAddress, boolean enabled);
}
