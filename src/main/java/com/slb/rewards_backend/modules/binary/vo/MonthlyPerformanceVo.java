package com.slb.rewards_backend.modules.binary.vo;

import com.slb.rewards_backend.modules.binary.entity.MonthlyPerformance;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Schema(description = "月度业绩 / Monthly performance")
public class MonthlyPerformanceVo {
    private Long userId;
    private Integer year;
    private Integer month;
    @Schema(description = "个人 PV / Personal PV", example = "120.00")
    private BigDecimal personalPv;
    @Schema(description = "左区 PV / Left leg PV", example = "300.00")
    private BigDecimal leftLegPv;
    @Schema(description = "右区 PV / Right leg PV", example = "100.00")
    private BigDecimal rightLegPv;
    private BigDecimal totalGroupPv;
    @Schema(description = "直推奖 / Direct referral bonus", example = "50.00")
    private BigDecimal directReferralBonus;
    @Schema(description = "层级奖 / Level commissions", example = "20.00")
    private BigDecimal levelCommissions;
    @Schema(description = "对碰奖 / Group volume bonus", example = "500.00")
    private BigDecimal groupVolumeBonus;
    private BigDecimal totalEarnings;
    private LocalDateTime updateTime;

    public static MonthlyPerformanceVo from(MonthlyPerformance row) {
        MonthlyPerformanceVo vo = new MonthlyPerformanceVo();
        vo.setUserId(row.getUserId());
        vo.setYear(row.getYear());
        vo.setMonth(row.getMonth());
        vo.setPersonalPv(row.getPersonalPv());
        vo.setLeftLegPv(row.getLeftLegPv());
        vo.setRightLegPv(row.getRightLegPv());
        vo.setTotalGroupPv(row.getTotalGroupPv());
        vo.setDirectReferralBonus(row.getDirectReferralBonus());
        vo.setLevelCommissions(row.getLevelCommissions());
        vo.setGroupVolumeBonus(row.getGroupVolumeBonus());
        vo.setTotalEarnings(row.getTotalEarnings());
        vo.setUpdateTime(row.getUpdateTime());
        return vo;
    }
}
