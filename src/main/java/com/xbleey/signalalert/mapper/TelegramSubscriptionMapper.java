package com.xbleey.signalalert.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.signalalert.model.TelegramSubscription;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface TelegramSubscriptionMapper extends BaseMapper<TelegramSubscription> {
}
