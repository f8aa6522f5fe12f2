package com.slb.rewards_backend.modules.genealogy.mapper;

import lombok.Data;

/**
 * 按等级分组的人数，rankId 为 null 表示未定级。
 */
@Data
public class RankCountRow {
    private Long rankId;
    private Long userCount;
}
