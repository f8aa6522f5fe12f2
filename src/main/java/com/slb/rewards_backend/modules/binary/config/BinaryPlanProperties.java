package com.slb.rewards_backend.modules.binary.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 双轨制奖金方案。
 */
@Component
@ConfigurationProperties(prefix = "app.binary")
@Data
public class BinaryPlanProperties {

    /**
     * 层级奖计算的最大安置深度
     */
    private int maxDepth = 6;

    /**
     * 安置树查询默认展开深度及上限
     */
    private int treeDefaultDepth = 6;
    private int treeMaxDepth = 10;

    /**
     * 月结批量写入时每批行数
     */
    private int writeBatchSize = 500;

    private DirectReferral directReferral = new DirectReferral();

    private List<LevelRate> levelRates = new ArrayList<>();

    /**
     * 对碰奖档位，按 minWeakerLegPv 取满足条件的最高一档
     */
    private List<GroupVolumeTier> groupVolumeTiers = new ArrayList<>();

    @Data
    public static class DirectReferral {
        private boolean enabled = true;
        /** fixed：每个新直推固定金额；percentage：新直推本期个人 PV 的百分比 */
        private String rewardType = "fixed";
        private BigDecimal fixedAmount = BigDecimal.ZERO;
        private BigDecimal percentage = BigDecimal.ZERO;
    }

    @Data
    public static class LevelRate {
        private int level;
        /** 百分比，例如 5 表示 5% */
        private BigDecimal percentage;
    }

    @Data
    public static class GroupVolumeTier {
        /** 弱区 PV 达到该值才适用本档 */
        private BigDecimal minWeakerLegPv = BigDecimal.ZERO;
        /** 每对碰单位 PV */
        private BigDecimal pairPv;
        /** 每对碰奖金 */
        private BigDecimal pairBonus;
        /** 本档封顶，可为空 */
        private BigDecimal maxBonus;
    }
}
