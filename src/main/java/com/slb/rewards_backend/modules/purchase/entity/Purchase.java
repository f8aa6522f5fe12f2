package com.slb.rewards_backend.modules.purchase.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：purchases
 *
 * 订单由外部结算系统写入，本服务只读；创建后除 status 外不可修改。
 */
@Data
public class Purchase implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_CANCELLED = "cancelled";

    private Long id;
    private Long userId;
    private Long productId;
    private Integer quantity;

    /**
     * 订单金额（返利计算基数）
     */
    private BigDecimal totalAmount;

    /**
     * 订单 PV（双轨制业绩基数）
     */
    private BigDecimal totalPv;

    /**
     * pending / completed / cancelled
     */
    private String status;

    private LocalDateTime createTime;
    private LocalDateTime updateTime;

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
