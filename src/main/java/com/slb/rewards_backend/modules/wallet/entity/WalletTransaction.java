package com.slb.rewards_backend.modules.wallet.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 钱包流水记录。
 * 对应 wallet_transactions 表，UNIQUE(ref_type, ref_id) 保证同一业务记录只入账一次。
 */
@Data
public class WalletTransaction implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String TYPE_REBATE = "rebate";
    public static final String STATUS_COMPLETED = "completed";

    private Long id;
    private Long userId;
    /** 入账金额，正数为收入 */
    private BigDecimal amount;
    /** 流水类型（rebate 等） */
    private String type;
    /** 关联业务类型（rebate） */
    private String refType;
    /** 关联的业务记录 ID */
    private Long refId;
    /** completed */
    private String status;
    private String description;
    private LocalDateTime createTime;
}
