package com.slb.rewards_backend.modules.genealogy.vo;

import com.slb.rewards_backend.modules.users.entity.User;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "族谱节点 / Genealogy node")
public class GenealogyNodeVo {
    private Long id;
    private String name;
    private String email;
    private Long uplineId;
    private Long rankId;

    @Schema(description = "相对查询根节点的层级，根为 0 / Level relative to the queried root", example = "1")
    private Integer level;

    private LocalDateTime createTime;

    @Schema(description = "直属下级数量，仅最深一层节点返回，用于按需展开 / Direct child count on the deepest loaded level")
    private Long pendingChildCount;

    private List<GenealogyNodeVo> children = new ArrayList<>();

    public static GenealogyNodeVo of(User user, int level) {
        GenealogyNodeVo vo = new GenealogyNodeVo();
        vo.setId(user.getId());
        vo.setName(user.getName());
        vo.setEmail(user.getEmail());
        vo.setUplineId(user.getUplineId());
        vo.setRankId(user.getRankId());
        vo.setLevel(level);
        vo.setCreateTime(user.getCreateTime());
        return vo;
    }
}
