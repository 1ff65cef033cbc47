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
@TableName("signal_alert_history")
public class SignalAlertHistory {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("wallet_address")
    private String walletAddress;

    @TableField("chain_id")
    private Long chainId;

    @TableField("token_address")
    private String tokenAddress;

    @TableField("signal_type")
    private String signalType;

    @TableField("severity")
    private String severity;

    @TableField("impact_level")
    private String impactLevel;

    @TableField("impact_score")
    private Integer impactScore;

    @TableField("confidence")
    private BigDecimal confidence;

    @TableField("liquidity_drop_percent")
    private BigDecimal liquidityDropPercent;

    @TableField("escalation_reason")
    private String escalationReason;

    @TableField("telegram_message_id")
    private Long telegramMessageId;

    @TableField("dry_run")
    private Boolean dryRun;

    @TableField("sent_at")
    private Instant sentAt;

    @TableField("created_at")
    private Instant createdAt;
}
