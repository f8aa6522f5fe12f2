package com.slb.rewards_backend.modules.rebate.vo;

import com.slb.rewards_backend.modules.rebate.entity.Rebate;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Schema(description = "返利记录 / Rebate")
public class RebateVo {
    private Long id;
    private Long purchaseId;
    @Schema(description = "下单用户 / Generator (buyer)", example = "1003")
    private Long generatorId;
    @Schema(description = "收款上级 / Receiver", example = "1001")
    private Long receiverId;
    @Schema(description = "层级 / Level", example = "2")
    private Integer level;
    private String rewardType;
    private BigDecimal percentage;
    @Schema(description = "返利金额 / Amount", example = "50.00")
    private BigDecimal amount;
    @Schema(description = "pending / processed / failed", example = "processed")
    private String status;
    private String failureReason;
    private Long walletTransactionId;
    private LocalDateTime createTime;
    private LocalDateTime processedTime;

    public static RebateVo from(Rebate rebate) {
        RebateVo vo = new RebateVo();
        vo.setId(rebate.getId());
        vo.setPurchaseId(rebate.getPurchaseId());
        vo.setGeneratorId(rebate.getGeneratorId());
        vo.setReceiverId(rebate.getReceiverId());
        vo.setLevel(rebate.getLevel());
        vo.setRewardType(rebate.getRewardType());
        vo.setPercentage(rebate.getPercentage());
        vo.setAmount(rebate.getAmount());
        vo.setStatus(rebate.getStatus());
        vo.setFailureReason(rebate.getFailureReason());
        vo.setWalletTransactionId(rebate.getWalletTransactionId());
        vo.setCreateTime(rebate.getCreateTime());
        vo.setProcessedTime(rebate.getProcessedTime());
        return vo;
    }
}
