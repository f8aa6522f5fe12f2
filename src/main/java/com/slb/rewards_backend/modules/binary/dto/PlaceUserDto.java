package com.slb.rewards_backend.modules.binary.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Schema(description = "安置用户 / Place a user into the binary tree")
public class PlaceUserDto {

    @NotNull
    @Schema(description = "安置父节点 / Placement parent", example = "1001")
    private Long parentId;

    @Schema(description = "left / right；为空时从父节点开始自动寻找空位", example = "left")
    private String position;

    @Schema(description = "自动寻位时优先的区：left / right，默认 left", example = "left")
    private String preferredLeg;
}
