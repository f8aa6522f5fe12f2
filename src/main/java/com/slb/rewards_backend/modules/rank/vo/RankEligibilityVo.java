package com.slb.rewards_backend.modules.rank.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "晋升资格 / Rank eligibility")
public class RankEligibilityVo {
    private Long userId;
    private boolean eligible;
    @Schema(description = "当前等级，未定级为空 / Current rank, null when unranked")
    private RankVo currentRank;
    @Schema(description = "下一等级，已是最高等级时为空 / Next rank, null at the top")
    private RankVo nextRank;
    @Schema(description = "未达标的考核项 / Requirements not met")
    private List<String> missingRequirements = new ArrayList<>();
    private List<RequirementCheckVo> checks = new ArrayList<>();
    private String message;

    // 考核时点数据，晋升时写入审计记录
    private BigDecimal personalSales = BigDecimal.ZERO;
    private BigDecimal groupSales = BigDecimal.ZERO;
    private long directDownlineCount;
    private long qualifiedDownlineCount;
}
