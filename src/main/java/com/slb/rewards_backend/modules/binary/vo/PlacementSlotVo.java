package com.slb.rewards_backend.modules.binary.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "可安置位置 / Placement slot")
public class PlacementSlotVo {
    @Schema(description = "安置父节点 / Placement parent", example = "1001")
    private Long parentId;
    @Schema(description = "left / right", example = "left")
    private String position;
}
