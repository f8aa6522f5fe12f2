package com.slb.rewards_backend.modules.rebate.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：rebates，UNIQUE(purchase_id, level)
 *
 * 状态约定：
 * - pending：已生成，等待入账
 * - processed：已入账，walletTransactionId 指向 wallet_transactions.id
 * - failed：入账失败，failureReason 记录原因
 */
@Data
public class Rebate implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Long purchaseId;

    /**
     * 下单用户（产生返利的人）
     */
    private Long generatorId;

    /**
     * 收款上级
     */
    private Long receiverId;

    private Integer level;

    /**
     * 生成时使用的奖励类型快照
     */
    private String rewardType;

    /**
     * 生成时使用的百分比快照（fixed 类型为空）
     */
    private BigDecimal percentage;

    /**
     * 返利金额，2 位小数（HALF_UP）
     */
    private BigDecimal amount;

    private String status;
    private String failureReason;
    private Long walletTransactionId;

    private LocalDateTime createTime;
    private LocalDateTime processedTime;
}
