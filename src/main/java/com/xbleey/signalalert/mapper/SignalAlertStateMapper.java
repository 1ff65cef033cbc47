package com.xbleey.signalalert.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.signalalert.model.SignalAlertState;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface SignalAlertStateMapper extends BaseMapper<SignalAlertState> {
}
