package com.slb.rewards_backend.modules.genealogy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 族谱（推荐关系树）查询配置。
 */
@Component
@Data
@ConfigurationProperties(prefix = "app.genealogy")
public class GenealogyProperties {

    /**
     * 未指定 maxLevel 时的默认展开层数
     */
    private int defaultMaxLevel = 10;

    /**
     * 单次请求允许展开的最大层数，超过则截断到该值
     */
    private int maxLevelLimit = 20;

    private int defaultPageSize = 20;

    private int maxPageSize = 100;

    /**
     * 单条 IN (...) 查询的最大 id 个数
     */
    private int queryChunkSize = 1000;

    /**
     * “新成员”统计窗口（天）
     */
    private int newMemberWindowDays = 30;

    /**
     * “活跃成员”统计窗口（天）：窗口内有已完成订单
     */
    private int activeWindowDays = 30;
}
