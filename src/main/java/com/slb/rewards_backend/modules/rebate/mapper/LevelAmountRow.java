package com.slb.rewards_backend.modules.rebate.mapper;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 按层级汇总的返利金额。
 */
@Data
public class LevelAmountRow {
    private Integer level;
    private Long count;
    private BigDecimal amount;
}
