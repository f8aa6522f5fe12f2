package com.slb.rewards_backend.modules.rank.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "单项晋升考核 / Single requirement check")
public class RequirementCheckVo {
    @Schema(description = "考核项：PERSONAL_SALES / GROUP_SALES / DIRECT_DOWNLINE / QUALIFIED_DOWNLINE", example = "DIRECT_DOWNLINE")
    private String requirement;
    private BigDecimal required;
    private BigDecimal actual;
    private boolean met;
}
