package com.slb.rewards_backend.modules.genealogy.controller;

import com.slb.rewards_backend.common.api.ApiResponse;
import com.slb.rewards_backend.modules.genealogy.dto.DownlineFilter;
import com.slb.rewards_backend.modules.genealogy.service.GenealogyService;
import com.slb.rewards_backend.modules.genealogy.vo.DownlineTreeVo;
import com.slb.rewards_backend.modules.genealogy.vo.GenealogyStatisticsVo;
import com.slb.rewards_backend.modules.genealogy.vo.LevelExpansionVo;
import com.slb.rewards_backend.modules.genealogy.vo.PerformanceMetricsVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/genealogy")
@Tag(name = "用户端/族谱", description = "推荐关系树、层级人数与团队业绩")
public class GenealogyController {

    private final GenealogyService genealogyService;

    public GenealogyController(GenealogyService genealogyService) {
        this.genealogyService = genealogyService;
    }

    @GetMapping("/{userId}")
    @Operation(
            summary = "查询族谱树",
            description = """
                    返回根节点与分页的直属下级，每个下级带子树直到 maxLevel（超出上限时按上限截断）。
                    最深一层节点携带 pendingChildCount，可通过 /levels 接口继续展开。

                    示例请求 (cURL):
                    curl -X GET "http://localhost:8080/api/v1/genealogy/1001?maxLevel=3&page=1&pageSize=20&sortBy=createTime&sortDir=asc"
                    """
    )
    public ApiResponse<DownlineTreeVo> getDownline(
            @Parameter(description = "根用户ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "展开层数，默认 10", example = "3") @RequestParam(required = false) Integer maxLevel,
            @Parameter(description = "直属下级页码，从 1 开始", example = "1") @RequestParam(defaultValue = "1") Integer page,
            @Parameter(description = "直属下级每页数量", example = "20") @RequestParam(required = false) Integer pageSize,
            @Parameter(description = "按等级过滤") @RequestParam(required = false) Long rankId,
            @Parameter(description = "姓名/邮箱关键字") @RequestParam(required = false) String keyword,
            @Parameter(description = "加入时间下限，ISO 格式", example = "2025-01-01T00:00:00")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime joinedAfter,
            @Parameter(description = "排序字段：createTime / name / id", example = "createTime") @RequestParam(required = false) String sortBy,
            @Parameter(description = "排序方向：asc / desc", example = "asc") @RequestParam(required = false) String sortDir) {
        DownlineFilter filter = new DownlineFilter();
        filter.setRankId(rankId);
        filter.setKeyword(keyword);
        filter.setJoinedAfter(joinedAfter);
        filter.setSortBy(sortBy);
        filter.setSortDir(sortDir);
        return ApiResponse.ok(genealogyService.getDownline(userId, maxLevel, page, pageSize, filter));
    }

    @GetMapping("/{userId}/levels")
    @Operation(summary = "按需展开节点", description = "返回节点在 currentLevel 之下、直到 maxLevel 的后代。")
    public ApiResponse<LevelExpansionVo> loadAdditionalLevels(
            @Parameter(description = "待展开节点ID", example = "1005") @PathVariable Long userId,
            @Parameter(description = "该节点当前所在层级", example = "3") @RequestParam int currentLevel,
            @Parameter(description = "展开到的层级", example = "6") @RequestParam(required = false) Integer maxLevel) {
        return ApiResponse.ok(genealogyService.loadAdditionalLevels(userId, currentLevel, maxLevel));
    }

    @GetMapping("/{userId}/level-counts")
    @Operation(summary = "每层下级人数", description = "key 为层级（1 为直属），超过 maxLevel 的层不统计。")
    public ApiResponse<Map<Integer, Long>> getLevelCounts(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "统计层数，默认 10", example = "10") @RequestParam(required = false) Integer maxLevel) {
        return ApiResponse.ok(genealogyService.getLevelCounts(userId, maxLevel));
    }

    @GetMapping("/{userId}/metrics")
    @Operation(summary = "个人及团队业绩", description = "个人销售、团队销售、已到账返利、团队人数与近 30 天新成员。")
    public ApiResponse<PerformanceMetricsVo> getPerformanceMetrics(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId) {
        return ApiResponse.ok(genealogyService.getPerformanceMetrics(userId));
    }

    @GetMapping("/{userId}/statistics")
    @Operation(summary = "团队统计", description = "maxLevel 层以内的团队人数、每层人数、近 30 天活跃成员及等级分布。")
    public ApiResponse<GenealogyStatisticsVo> getStatistics(
            @Parameter(description = "用户ID", example = "1001") @PathVariable Long userId,
            @Parameter(description = "统计层数，默认 10", example = "6") @RequestParam(required = false) Integer maxLevel) {
        return ApiResponse.ok(genealogyService.getStatistics(userId, maxLevel));
    }
}
