package com.slb.rewards_backend.modules.genealogy.mapper;

import lombok.Data;

/**
 * 按推荐人分组的直属下级数量。
 */
@Data
public class ChildCountRow {
    private Long uplineId;
    private Long childCount;
}
