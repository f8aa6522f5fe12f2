package com.slb.rewards_backend.modules.users.enums;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 双轨制安置位置。
 */
@Schema(description = "安置位置：left 左区 / right 右区。/ Binary leg position.")
public enum LegPosition {
    LEFT("left"),
    RIGHT("right");

    private final String code;

    LegPosition(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public LegPosition opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }

    public static LegPosition fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (LegPosition value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}
