package com.slb.rewards_backend.modules.users.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：users
 *
 * 两套互相独立的关系：
 * - uplineId：推荐（赞助）关系，返利与团队统计沿此关系向上/向下遍历；
 * - placementParentId / leftLegId / rightLegId：双轨制安置关系，仅用于左右区业绩计算。
 */
@Data
public class User implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    private String name;
    private String email;

    /**
     * 推荐人用户ID，根节点为空
     */
    private Long uplineId;

    /**
     * 当前等级 ranks.id，新用户可为空（视为未定级）
     */
    private Long rankId;

    /**
     * 钱包余额，只允许通过原子增量 SQL 修改
     */
    private BigDecimal walletBalance;

    // --- 双轨制安置 ---
    private Long placementParentId;
    /**
     * left / right
     */
    private String placementPosition;
    private Long leftLegId;
    private Long rightLegId;

    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
