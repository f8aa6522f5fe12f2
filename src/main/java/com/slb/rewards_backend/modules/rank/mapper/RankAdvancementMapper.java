package com.slb.rewards_backend.modules.rank.mapper;

import com.slb.rewards_backend.modules.rank.entity.RankAdvancement;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface RankAdvancementMapper {

    int insert(RankAdvancement advancement);

    /**
     * 用户晋升历史，按时间倒序。
     */
    List<RankAdvancement> selectByUserId(@Param("userId") Long userId);

    List<RankAdvancement> selectPage(@Param("offset") int offset, @Param("size") int size);

    long countAll();
}
