package com.slb.rewards_backend.modules.rebate.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：rebate_configs，UNIQUE(product_id, level)
 *
 * rewardType=percentage 时只有 percentage 有值；rewardType=fixed 时只有 fixedAmount 有值。
 */
@Data
public class RebateConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Long productId;

    /**
     * 上级层级，1 为直属推荐人
     */
    private Integer level;

    /**
     * percentage / fixed
     */
    private String rewardType;

    /**
     * 百分比 [0, 100]
     */
    private BigDecimal percentage;

    /**
     * 固定金额，>= 0
     */
    private BigDecimal fixedAmount;

    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
