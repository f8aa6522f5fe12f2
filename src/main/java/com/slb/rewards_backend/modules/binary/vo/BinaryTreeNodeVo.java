package com.slb.rewards_backend.modules.binary.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "安置树节点 / Binary tree node")
public class BinaryTreeNodeVo {
    private Long userId;
    private String name;
    private String email;
    private Long rankId;
    @Schema(description = "相对根节点的深度，根为 0 / Depth from the root", example = "1")
    private Integer level;
    @Schema(description = "在父节点下的位置：left / right，根为空", example = "left")
    private String position;
    private BinaryTreeNodeVo left;
    private BinaryTreeNodeVo right;
}
