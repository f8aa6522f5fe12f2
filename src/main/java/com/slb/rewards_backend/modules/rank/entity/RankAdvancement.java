package com.slb.rewards_backend.modules.rank.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：rank_advancements，只追加不修改。记录晋升时刻的考核数据。
 */
@Data
public class RankAdvancement implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Long userId;
    private Long previousRankId;
    private Long newRankId;
    private BigDecimal personalSales;
    private BigDecimal groupSales;
    private Long directDownlineCount;
    private Long qualifiedDownlineCount;
    private LocalDateTime createTime;
}
