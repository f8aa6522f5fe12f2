package com.slb.rewards_backend.modules.rebate.enums;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 返利奖励类型。两种字段互斥，写入配置时校验。
 */
@Schema(description = "奖励类型：percentage 按订单金额百分比 / fixed 固定金额。/ Reward type.")
public enum RewardType {
    PERCENTAGE("percentage"),
    FIXED("fixed");

    private final String code;

    RewardType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RewardType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (RewardType value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}
