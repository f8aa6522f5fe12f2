package com.slb.rewards_backend.modules.wallet.vo;

import com.slb.rewards_backend.common.vo.PageVo;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "钱包概览 / Wallet overview")
public class WalletVo {
    private Long userId;
    @Schema(description = "当前余额 / Current balance", example = "150.00")
    private BigDecimal walletBalance;
    @Schema(description = "流水分页 / Paged transactions")
    private PageVo<WalletTransactionVo> transactions;
}
