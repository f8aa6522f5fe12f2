package com.slb.rewards_backend.modules.rebate.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.common.vo.PageVo;
import com.slb.rewards_backend.modules.rebate.service.RebateQueryService;
import com.slb.rewards_backend.modules.rebate.vo.RebateStatsVo;
import com.slb.rewards_backend.modules.rebate.vo.RebateVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/rebates")
@Tag(name = "用户端/返利", description = "查询收到的返利及统计")
public class RebateController {

    private final RebateQueryService rebateQueryService;

    public RebateController(RebateQueryService rebateQueryService) {
        this.rebateQueryService = rebateQueryService;
    }

    @GetMapping("/{userId}")
    @Operation(summary = "收到的返利", description = "按创建时间倒序分页，可按状态过滤。")
    public ApiResponse<PageVo<RebateVo>> listReceived(
            @Parameter(description = "收款用户ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "状态：pending / processed / failed") @RequestParam(required = false) String status,
            @Parameter(description = "页码，从 1 开始", example = "1") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页数量", example = "10") @RequestParam(defaultValue = "10") int size) {
        return ApiResponse.ok(rebateQueryService.listReceived(userId, status, page, size));
    }

    @GetMapping("/{userId}/stats")
    @Operation(summary = "返利统计", description = "已到账 / 待入账 / 失败金额，以及按层级的已到账汇总。")
    public ApiResponse<RebateStatsVo> getStats(
            @Parameter(description = "收款用户ID", example = "1001") @PathVariable Long userId) {
        return ApiResponse.ok(rebateQueryService.getStats(userId));
    }
}
