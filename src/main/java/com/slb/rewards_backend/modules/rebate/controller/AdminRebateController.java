package com.slb.rewards_backend.modules.rebate.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.common.vo.PageVo;
import com.slb.rewards_backend.modules.rebate.service.RebateProcessingService;
import com.slb.rewards_backend.modules.rebate.service.RebateQueryService;
import com.slb.rewards_backend.modules.rebate.vo.RebateProcessSummaryVo;
import com.slb.rewards_backend.modules.rebate.vo.RebateVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/rebates")
@Tag(name = "管理员/返利", description = "返利批量入账与返利记录查询")
public class AdminRebateController {

    private final RebateProcessingService rebateProcessingService;
    private final RebateQueryService rebateQueryService;

    public AdminRebateController(RebateProcessingService rebateProcessingService, RebateQueryService rebateQueryService) {
        this.rebateProcessingService = rebateProcessingService;
        this.rebateQueryService = rebateQueryService;
    }

    @PostMapping("/process")
    @Operation(
            summary = "手动触发 pending 返利入账",
            description = """
                    处理全部 pending 返利：逐条抢占、加余额、写流水。可重复调用，已处理的行不会再次入账。
                    返回本次 processed / failed / skipped 统计与失败明细。
                    """
    )
    public ApiResponse<RebateProcessSummaryVo> processPendingRebates() {
        return ApiResponse.ok(rebateProcessingService.processPendingRebates());
    }

    @GetMapping
    @Operation(summary = "按状态查询返利记录")
    public ApiResponse<PageVo<RebateVo>> listRebates(
            @Parameter(description = "状态：pending / processed / failed，不填查全部") @RequestParam(required = false) String status,
            @Parameter(description = "页码，从 1 开始", example = "1") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页数量", example = "20") @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(rebateQueryService.listByStatus(status, page, size));
    }
}
