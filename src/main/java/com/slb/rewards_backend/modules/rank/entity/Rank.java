package com.slb.rewards_backend.modules.rank.entity;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 对应表：ranks
 *
 * level 从 1 开始连续递增，用户只能逐级向上晋升。
 */
@Data
public class Rank implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Integer level;
    private String name;
    private String description;

    /**
     * 等级权益描述（展示用）
     */
    private String benefits;

    private LocalDateTime createTime;
}
