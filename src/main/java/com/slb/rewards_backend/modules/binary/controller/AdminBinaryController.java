package com.slb.rewards_backend.modules.binary.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.modules.binary.service.BinaryPlacementService;
import com.slb.rewards_backend.modules.binary.service.MonthlySnapshotService;
import com.slb.rewards_backend.modules.binary.vo.MonthlySnapshotSummaryVo;
import com.slb.rewards_backend.modules.binary.vo.TopEarnerVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/binary")
@Tag(name = "管理端/双轨制", description = "月结与收益排行")
public class AdminBinaryController {

    private final MonthlySnapshotService snapshotService;
    private final BinaryPlacementService placementService;

    public AdminBinaryController(MonthlySnapshotService snapshotService, BinaryPlacementService placementService) {
        this.snapshotService = snapshotService;
        this.placementService = placementService;
    }

    @PostMapping("/snapshots")
    @Operation(summary = "执行月结", description = """
            计算指定自然月的个人 PV、左右区 PV 与各项奖金，并覆盖写入月度业绩。
            - 可重复执行，结果一致
            - 安置数据异常的用户会被跳过并在结果中列出
            """)
    public ApiResponse<MonthlySnapshotSummaryVo> runSnapshot(
            @Parameter(description = "年份", example = "2026") @RequestParam int year,
            @Parameter(description = "月份 1-12", example = "9") @RequestParam int month,
            @Parameter(description = "是否在结果中返回业绩行") @RequestParam(defaultValue = "false") boolean includeRows) {
        return ApiResponse.ok(snapshotService.runMonthlySnapshot(year, month, includeRows));
    }

    @GetMapping("/top-earners")
    @Operation(summary = "收益排行", description = "按本期总收益倒序，limit 默认 10，最多 100。")
    public ApiResponse<List<TopEarnerVo>> getTopEarners(
            @Parameter(description = "年份", example = "2026") @RequestParam int year,
            @Parameter(description = "月份 1-12", example = "9") @RequestParam int month,
            @Parameter(description = "条数", example = "10") @RequestParam(required = false) Integer limit) {
        return ApiResponse.ok(placementService.getTopEarners(year, month, limit));
    }
}
