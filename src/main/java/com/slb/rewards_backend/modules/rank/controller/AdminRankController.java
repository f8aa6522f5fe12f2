package com.slb.rewards_backend.modules.rank.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.common.vo.PageVo;
import com.slb.rewards_backend.modules.rank.service.RankAdvancementService;
import com.slb.rewards_backend.modules.rank.vo.RankAdvancementVo;
import com.slb.rewards_backend.modules.rank.vo.RankBatchSummaryVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/ranks")
@Tag(name = "管理员/等级", description = "全量晋升评估与晋升记录")
public class AdminRankController {

    private final RankAdvancementService rankAdvancementService;

    public AdminRankController(RankAdvancementService rankAdvancementService) {
        this.rankAdvancementService = rankAdvancementService;
    }

    @PostMapping("/process-all")
    @Operation(summary = "全量晋升评估", description = "逐个用户评估并晋升，单个用户失败不影响其他用户。")
    public ApiResponse<RankBatchSummaryVo> processAll() {
        return ApiResponse.ok(rankAdvancementService.processAllRankAdvancements());
    }

    @GetMapping("/advancements")
    @Operation(summary = "晋升记录分页")
    public ApiResponse<PageVo<RankAdvancementVo>> listAdvancements(
            @Parameter(description = "页码，从 1 开始", example = "1") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页数量", example = "20") @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(rankAdvancementService.listAdvancements(page, size));
    }
}
