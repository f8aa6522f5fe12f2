package com.slb.rewards_backend.modules.rebate.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "返利统计 / Rebate stats")
public class RebateStatsVo {
    private Long userId;
    @Schema(description = "已到账总额 / Total processed", example = "150.00")
    private BigDecimal totalProcessed = BigDecimal.ZERO;
    @Schema(description = "待入账总额 / Total pending", example = "20.00")
    private BigDecimal totalPending = BigDecimal.ZERO;
    @Schema(description = "失败总额 / Total failed", example = "0.00")
    private BigDecimal totalFailed = BigDecimal.ZERO;
    @Schema(description = "按层级统计（已到账）/ Processed totals per level")
    private List<LevelStat> byLevel = new ArrayList<>();

    @Data
    public static class LevelStat {
        private Integer level;
        private Long count;
        private BigDecimal amount;
    }
}
