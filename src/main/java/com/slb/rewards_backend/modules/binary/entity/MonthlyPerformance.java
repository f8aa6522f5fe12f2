package com.slb.rewards_backend.modules.binary.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：monthly_performance，UNIQUE(user_id, year, month)
 *
 * 每次月结重算都整行覆盖，不做累加。
 */
@Data
public class MonthlyPerformance implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Long userId;
    private Integer year;
    private Integer month;

    private BigDecimal personalPv;
    private BigDecimal leftLegPv;
    private BigDecimal rightLegPv;
    private BigDecimal totalGroupPv;

    private BigDecimal directReferralBonus;
    private BigDecimal levelCommissions;
    private BigDecimal groupVolumeBonus;
    private BigDecimal totalEarnings;

    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
