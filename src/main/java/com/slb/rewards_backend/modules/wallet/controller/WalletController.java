package com.slb.rewards_backend.modules.wallet.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.modules.wallet.service.WalletLedgerService;
import com.slb.rewards_backend.modules.wallet.vo.WalletVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/wallet")
@Tag(name = "用户端/钱包", description = "钱包余额与入账流水查询")
public class WalletController {

    private final WalletLedgerService walletLedgerService;

    public WalletController(WalletLedgerService walletLedgerService) {
        this.walletLedgerService = walletLedgerService;
    }

    @GetMapping("/{userId}")
    @Operation(
            summary = "查询钱包余额与流水",
            description = """
                    返回用户当前余额以及按时间倒序的入账流水（返利入账等）。

                    示例请求 (cURL):
                    curl -X GET "http://localhost:8080/api/v1/wallet/1001?page=1&size=10"
                    """
    )
    public ApiResponse<WalletVo> getWallet(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "页码，从 1 开始", example = "1") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页数量", example = "10") @RequestParam(defaultValue = "10") int size) {
        return ApiResponse.ok(walletLedgerService.getWallet(userId, page, size));
    }
}
