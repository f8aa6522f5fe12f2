package com.slb.rewards_backend.modules.rebate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.rebate")
@Data
public class RebateProperties {

    /**
     * 允许配置的最大返利层级，同时也是上级链遍历的硬上限。
     */
    private int maxLevel = 10;

    /**
     * 单批拉取 pending 返利的数量（keyset 分页）。
     */
    private int processBatchSize = 200;

    /**
     * 入账完成后是否对收款人做一次等级评估。
     */
    private boolean evaluateRanksAfterProcessing = false;

    /**
     * failure_reason 列长度上限。
     */
    private int failureReasonMaxLength = 500;
}
