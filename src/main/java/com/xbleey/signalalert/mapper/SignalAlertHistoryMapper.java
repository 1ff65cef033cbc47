package com.xbleey.signalalert.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.signalalert.model.SignalAlertHistory;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface SignalAlertHistoryMapper extends BaseMapper<SignalAlertHistory> {
}
