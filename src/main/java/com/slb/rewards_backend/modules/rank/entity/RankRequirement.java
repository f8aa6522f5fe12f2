package com.slb.rewards_backend.modules.rank.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * 对应表：rank_requirements，每个等级一行，描述晋升到该等级的门槛。
 */
@Data
public class RankRequirement implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Long rankId;

    /**
     * 个人已完成订单金额
     */
    private BigDecimal requiredPersonalSales;

    /**
     * 团队业绩：本人 + 全部下级已完成订单金额
     */
    private BigDecimal requiredGroupSales;

    /**
     * 直推人数
     */
    private Integer requiredDirectDownline;

    /**
     * 达到 qualifiedRankId 等级（或更高）的下级人数
     */
    private Integer requiredQualifiedDownline;

    private Long qualifiedRankId;
}
