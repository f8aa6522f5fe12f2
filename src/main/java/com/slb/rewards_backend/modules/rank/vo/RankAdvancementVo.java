package com.slb.rewards_backend.modules.rank.vo;

import com.slb.rewards_backend.modules.rank.entity.RankAdvancement;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class RankAdvancementVo {
    private Long id;
    private Long userId;
    private Long previousRankId;
    private Long newRankId;
    private BigDecimal personalSales;
    private BigDecimal groupSales;
    private Long directDownlineCount;
    private Long qualifiedDownlineCount;
    private LocalDateTime createTime;

    public static RankAdvancementVo from(RankAdvancement entity) {
        RankAdvancementVo vo = new RankAdvancementVo();
        vo.setId(entity.getId());
        vo.setUserId(entity.getUserId());
        vo.setPreviousRankId(entity.getPreviousRankId());
        vo.setNewRankId(entity.getNewRankId());
        vo.setPersonalSales(entity.getPersonalSales());
        vo.setGroupSales(entity.getGroupSales());
        vo.setDirectDownlineCount(entity.getDirectDownlineCount());
        vo.setQualifiedDownlineCount(entity.getQualifiedDownlineCount());
        vo.setCreateTime(entity.getCreateTime());
        return vo;
    }
}
