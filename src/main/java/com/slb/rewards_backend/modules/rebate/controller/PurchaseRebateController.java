package com.slb.rewards_backend.modules.rebate.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.modules.rebate.service.RebateCalculationService;
import com.slb.rewards_backend.modules.rebate.vo.RebateVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 结算系统在订单置为 completed 后回调。
 */
@RestController
@RequestMapping("/api/v1/internal/purchases")
@Tag(name = "内部/订单返利", description = "订单完成后生成 pending 返利")
public class PurchaseRebateController {

    private final RebateCalculationService rebateCalculationService;

    public PurchaseRebateController(RebateCalculationService rebateCalculationService) {
        this.rebateCalculationService = rebateCalculationService;
    }

    @PostMapping("/{purchaseId}/rebates")
    @Operation(
            summary = "为已完成订单生成返利",
            description = """
                    沿下单用户的推荐链逐层生成 pending 返利，钱包入账由批处理完成。
                    订单不存在返回 404，订单未完成返回 409；重复调用只返回新生成的行。
                    """
    )
    public ApiResponse<List<RebateVo>> computeRebates(
            @Parameter(description = "订单ID", example = "9001") @PathVariable Long purchaseId) {
        return ApiResponse.ok(rebateCalculationService.computeRebatesForPurchase(purchaseId).stream()
                .map(RebateVo::from).toList());
    }
}
