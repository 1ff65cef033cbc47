package com.xbleey.signalalert.model;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.xbleey.signalalert.enums.ImpactFilter;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@TableName("telegram_subscription")
public class TelegramSubscription {

    public static final String DEFAULT_MIN_IMPACT = ImpactFilter.HIGH.code();
    public static final int DEFAULT_MIN_CONFIDENCE = 80;

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("wallet_address")
    private String walletAddress;

    @TableField("chat_id")
    private Long chatId;

    @TableField("enabled")
    private Boolean enabled;

    @TableField("min_impact")
    private String minImpact;

    @TableField("min_confidence")
    private Integer minConfidence;

    @TableField(value = "quiet_hours_start", updateStrategy = FieldStrategy.ALWAYS)
    private Integer quietHoursStart;

    @TableField(value = "quiet_hours_end", updateStrategy = FieldStrategy.ALWAYS)
    private Integer quietHoursEnd;

    @TableField("connected")
    private Boolean connected;

    @TableField("created_at")
    private Instant createdAt;

    @TableField("updated_at")
    private Instant updatedAt;

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean isConnected() {
        return Boolean.TRUE.equals(connected);
    }

    public ImpactFilter impactFilter() {
        try {
            ImpactFilter filter = ImpactFilter.fromCode(minImpact);
            return filter == null ? ImpactFilter.HIGH : filter;
        } catch (IllegalArgumentException ex) {
            return ImpactFilter.HIGH;
        }
    }

    public int minConfidenceOrDefault() {
        return minConfidence == null ? DEFAULT_MIN_CONFIDENCE : minConfidence;
    }

    public boolean hasQuietHours() {
        return quietHoursStart != null && quietHoursEnd != null;
    }

    /**
     * Quiet hours are a UTC window; a start after the end wraps around midnight.
     */
    public boolean isQuietHour(int utcHour) {
        if (!hasQuietHours()) {
            return false;
        }
        if (quietHoursStart <= quietHoursEnd) {
            return utcHour >= quietHoursStart && utcHour < quietHoursEnd;
        }
        return utcHour >= quietHoursStart || utcHour < quietHoursEnd;
    }
}
