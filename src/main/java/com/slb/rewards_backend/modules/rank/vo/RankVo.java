package com.slb.rewards_backend.modules.rank.vo;

import com.slb.rewards_backend.modules.rank.entity.Rank;
import com.slb.rewards_backend.modules.rank.entity.RankRequirement;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "等级及晋升门槛 / Rank with requirements")
public class RankVo {
    private Long id;
    @Schema(description = "等级序号，从 1 开始 / Rank level", example = "2")
    private Integer level;
    private String name;
    private String description;
    private String benefits;

    @Schema(description = "个人销售门槛 / Required personal sales", example = "500.00")
    private BigDecimal requiredPersonalSales;
    @Schema(description = "团队销售门槛 / Required group sales", example = "5000.00")
    private BigDecimal requiredGroupSales;
    @Schema(description = "直推人数门槛 / Required direct downline", example = "3")
    private Integer requiredDirectDownline;
    @Schema(description = "合格下级人数门槛 / Required qualified downline", example = "2")
    private Integer requiredQualifiedDownline;
    @Schema(description = "合格下级需达到的等级ID / Rank id a qualified downline must hold", example = "2")
    private Long qualifiedRankId;
    @Schema(description = "是否配置了晋升门槛 / Whether requirements are configured")
    private boolean requirementsConfigured;

    public static RankVo of(Rank rank, RankRequirement requirement) {
        RankVo vo = new RankVo();
        vo.setId(rank.getId());
        vo.setLevel(rank.getLevel());
        vo.setName(rank.getName());
        vo.setDescription(rank.getDescription());
        vo.setBenefits(rank.getBenefits());
        if (requirement != null) {
            vo.setRequirementsConfigured(true);
            vo.setRequiredPersonalSales(requirement.getRequiredPersonalSales());
            vo.setRequiredGroupSales(requirement.getRequiredGroupSales());
            vo.setRequiredDirectDownline(requirement.getRequiredDirectDownline());
            vo.setRequiredQualifiedDownline(requirement.getRequiredQualifiedDownline());
            vo.setQualifiedRankId(requirement.getQualifiedRankId());
        }
        return vo;
    }
}
