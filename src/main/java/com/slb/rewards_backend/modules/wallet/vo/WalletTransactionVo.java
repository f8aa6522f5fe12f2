package com.slb.rewards_backend.modules.wallet.vo;

import com.slb.rewards_backend.modules.wallet.entity.WalletTransaction;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Schema(description = "钱包流水 / Wallet transaction")
public class WalletTransactionVo {
    private Long id;
    @Schema(description = "金额（正数为入账）/ Amount", example = "100.00")
    private BigDecimal amount;
    @Schema(description = "流水类型 / Transaction type", example = "rebate")
    private String type;
    @Schema(description = "关联业务类型 / Reference type", example = "rebate")
    private String refType;
    @Schema(description = "关联业务ID / Reference id", example = "9001")
    private Long refId;
    private String status;
    private String description;
    private LocalDateTime createTime;

    public static WalletTransactionVo from(WalletTransaction tx) {
        WalletTransactionVo vo = new WalletTransactionVo();
        vo.setId(tx.getId());
        vo.setAmount(tx.getAmount());
        vo.setType(tx.getType());
        vo.setRefType(tx.getRefType());
        vo.setRefId(tx.getRefId());
        vo.setStatus(tx.getStatus());
        vo.setDescription(tx.getDescription());
        vo.setCreateTime(tx.getCreateTime());
        return vo;
    }
}
