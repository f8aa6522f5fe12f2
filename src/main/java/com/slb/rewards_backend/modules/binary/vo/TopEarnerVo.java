package com.slb.rewards_backend.modules.binary.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "月度收益排行 / Top earner")
public class TopEarnerVo {
    private Long userId;
    private String name;
    private String email;
    private Long rankId;
    private String rankName;
    private BigDecimal personalPv;
    private BigDecimal totalGroupPv;
    private BigDecimal directReferralBonus;
    private BigDecimal levelCommissions;
    private BigDecimal groupVolumeBonus;
    @Schema(description = "本期总收益 / Total earnings", example = "570.00")
    private BigDecimal totalEarnings;
}
