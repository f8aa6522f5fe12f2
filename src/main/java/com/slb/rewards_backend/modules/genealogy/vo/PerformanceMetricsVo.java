package com.slb.rewards_backend.modules.genealogy.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "个人及团队业绩 / Performance metrics")
public class PerformanceMetricsVo {
    private Long userId;
    @Schema(description = "个人已完成订单金额 / Personal completed sales", example = "1000.00")
    private BigDecimal personalSales;
    @Schema(description = "全部下级已完成订单金额 / Team completed sales", example = "5200.00")
    private BigDecimal teamSales;
    @Schema(description = "已到账返利 / Processed rebates received", example = "150.00")
    private BigDecimal rebatesEarned;
    @Schema(description = "全部下级人数 / Entire downline size", example = "42")
    private Long teamSize;
    @Schema(description = "窗口期内新加入的下级 / New members within the window", example = "5")
    private Long newTeamMembers;
    private Integer newMemberWindowDays;
}
