package com.xbleey.signalalert.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@TableName("signal_alert_state")
public class SignalAlertState {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("wallet_address")
    private String walletAddress;

    @TableField("token_address")
    private String tokenAddress;

    @TableField("signal_type")
    private String signalType;

    @TableField("last_impact")
    private String lastImpact;

    @TableField("last_confidence")
    private BigDecimal lastConfidence;

    @TableField("last_liquidity_drop")
    private BigDecimal lastLiquidityDrop;

    @TableField("last_alert_at")
    private Instant lastAlertAt;

    @TableField("updated_at")
    private Instant updatedAt;
}
