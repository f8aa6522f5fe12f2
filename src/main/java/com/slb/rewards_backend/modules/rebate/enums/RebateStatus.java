package com.slb.rewards_backend.modules.rebate.enums;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 返利状态：只允许 pending -> processed 或 pending -> failed，processed / failed 为终态。
 */
@Schema(description = "返利状态：pending 待入账 / processed 已入账 / failed 失败。/ Rebate status.")
public enum RebateStatus {
    PENDING("pending"),    // 待入账
    PROCESSED("processed"), // 已入账（钱包已加款）
    FAILED("failed");      // 入账失败，需人工处理，不会被自动重试

    private final String code;

    RebateStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RebateStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (RebateStatus value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}
