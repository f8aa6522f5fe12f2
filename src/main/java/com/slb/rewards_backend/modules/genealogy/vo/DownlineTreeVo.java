package com.slb.rewards_backend.modules.genealogy.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.Map;

@Data
@Schema(description = "族谱树（根节点 + 分页的直属下级，每个下级带子树）/ Downline tree")
public class DownlineTreeVo {

    private GenealogyNodeVo node;

    private Pagination pagination;

    private Metadata metadata;

    @Data
    public static class Pagination {
        private Integer page;
        private Integer pageSize;
        private Long totalChildren;
        private Integer totalPages;
    }

    @Data
    public static class Metadata {
        @Schema(description = "实际展开的最大层数 / Effective max level", example = "10")
        private Integer maxLevel;
        @Schema(description = "本次加载的节点数（不含根）/ Nodes loaded, root excluded")
        private Integer loadedNodes;
        @Schema(description = "本次加载结果中每层的节点数 / Loaded nodes per level")
        private Map<Integer, Long> loadedLevelCounts;
    }
}
