package com.slb.rewards_backend.modules.rank.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.rank")
@Data
public class RankProperties {

    /**
     * 全量晋升批处理时每批拉取的用户数
     */
    private int userBatchSize = 500;

    /**
     * 批处理结果中最多保留的失败明细条数
     */
    private int maxFailureDetails = 100;
}
