package com.slb.rewards_backend.modules.genealogy.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Schema(description = "团队统计 / Downline statistics")
public class GenealogyStatisticsVo {
    private Long userId;
    @Schema(description = "统计的层数 / Levels covered", example = "6")
    private Integer maxLevel;
    @Schema(description = "团队总人数（含本人）/ Team size including the user", example = "43")
    private Long totalUsers;
    @Schema(description = "直属下级人数 / Direct downline count", example = "5")
    private Long directDownlineCount;
    @Schema(description = "每层人数，key 为层级 / Members per level")
    private Map<Integer, Long> levelCounts = new LinkedHashMap<>();
    @Schema(description = "窗口期内有已完成订单的成员数 / Members with a completed purchase in the window", example = "12")
    private Long activeUsers;
    @Schema(description = "活跃成员占比（%）/ Active share of the downline", example = "28.57")
    private BigDecimal activeUserPercentage;
    private Integer activeWindowDays;
    @Schema(description = "按等级ID统计的人数 / Members per rank id")
    private Map<Long, Long> rankDistribution = new LinkedHashMap<>();
    @Schema(description = "未定级人数 / Members without a rank", example = "30")
    private Long unrankedCount;
}
