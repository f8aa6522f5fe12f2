package com.slb.rewards_backend.modules.rank.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.modules.rank.service.RankAdvancementService;
import com.slb.rewards_backend.modules.rank.service.RankService;
import com.slb.rewards_backend.modules.rank.vo.RankAdvanceResultVo;
import com.slb.rewards_backend.modules.rank.vo.RankAdvancementVo;
import com.slb.rewards_backend.modules.rank.vo.RankEligibilityVo;
import com.slb.rewards_backend.modules.rank.vo.RankVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ranks")
@Tag(name = "用户端/等级", description = "等级阶梯、晋升资格与晋升历史")
public class RankController {

    private final RankService rankService;
    private final RankAdvancementService rankAdvancementService;

    public RankController(RankService rankService, RankAdvancementService rankAdvancementService) {
        this.rankService = rankService;
        this.rankAdvancementService = rankAdvancementService;
    }

    @GetMapping
    @Operation(summary = "等级阶梯", description = "按 level 升序返回全部等级及晋升门槛。")
    public ApiResponse<List<RankVo>> getLadder() {
        return ApiResponse.ok(rankService.getLadder());
    }

    @GetMapping("/{userId}/eligibility")
    @Operation(
            summary = "晋升资格评估",
            description = """
                    对比用户当前数据与下一等级门槛：个人销售、团队销售（本人 + 全部下级已完成订单）、直推人数、合格下级人数。
                    missingRequirements 列出未达标项；已是最高等级时 nextRank 为空。
                    """
    )
    public ApiResponse<RankEligibilityVo> checkEligibility(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId) {
        return ApiResponse.ok(rankAdvancementService.checkEligibility(userId));
    }

    @PostMapping("/{userId}/advance")
    @Operation(summary = "尝试晋升", description = "满足条件则晋升一级并记录审计；不满足或并发冲突时 advanced=false。")
    public ApiResponse<RankAdvanceResultVo> advance(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId) {
        return ApiResponse.ok(rankAdvancementService.processAdvancement(userId));
    }

    @GetMapping("/{userId}/history")
    @Operation(summary = "晋升历史", description = "按时间倒序。")
    public ApiResponse<List<RankAdvancementVo>> getHistory(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId) {
        return ApiResponse.ok(rankAdvancementService.getHistory(userId));
    }
}
