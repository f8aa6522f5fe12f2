package com.slb.rewards_backend.modules.rebate.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 新增/修改返利配置。奖励字段的组合规则在服务层校验，不合法返回 422。
 */
@Data
@Schema(description = "返利配置 / Rebate config")
public class RebateConfigSaveDto {

    @NotNull
    @Schema(description = "商品ID / Product id", example = "501")
    private Long productId;

    @NotNull
    @Schema(description = "层级，1 为直属上级 / Level, 1 = direct sponsor", example = "1")
    private Integer level;

    @Schema(description = "奖励类型：percentage / fixed", example = "percentage")
    private String rewardType;

    @Schema(description = "百分比 [0,100]，仅 percentage 类型 / Percentage", example = "10")
    private BigDecimal percentage;

    @Schema(description = "固定金额 >= 0，仅 fixed 类型 / Fixed amount", example = "25.00")
    private BigDecimal fixedAmount;
}
