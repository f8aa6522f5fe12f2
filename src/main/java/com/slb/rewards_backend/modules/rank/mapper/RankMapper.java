package com.slb.rewards_backend.modules.rank.mapper;

import com.slb.rewards_backend.modules.rank.entity.Rank;
import com.slb.rewards_backend.modules.rank.entity.RankRequirement;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface RankMapper {

    /**
     * 全部等级，按 level 升序。
     */
    List<Rank> selectAllOrderByLevel();

    List<RankRequirement> selectAllRequirements();

    /**
     * 统计给定用户中等级 level >= minLevel 的人数。
     */
    long countUsersAtOrAboveLevel(@Param("userIds") Collection<Long> userIds, @Param("minLevel") int minLevel);
}
