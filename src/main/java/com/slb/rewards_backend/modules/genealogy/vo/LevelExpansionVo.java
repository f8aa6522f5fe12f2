package com.slb.rewards_backend.modules.genealogy.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

@Data
@Schema(description = "节点按需展开结果 / Lazy level expansion")
public class LevelExpansionVo {
    private Long userId;
    @Schema(description = "首个返回层级 / First returned level", example = "4")
    private Integer fromLevel;
    @Schema(description = "最后返回层级 / Last returned level", example = "6")
    private Integer toLevel;
    private List<GenealogyNodeVo> nodes;
}
