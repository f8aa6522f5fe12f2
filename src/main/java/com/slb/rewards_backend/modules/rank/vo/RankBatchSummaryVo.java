package com.slb.rewards_backend.modules.rank.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "全量晋升批处理结果 / Rank batch summary")
public class RankBatchSummaryVo {
    @Schema(description = "评估用户数 / Users evaluated", example = "1200")
    private int processed;
    @Schema(description = "晋升人数 / Users advanced", example = "8")
    private int advanced;
    @Schema(description = "评估失败人数 / Users that failed", example = "0")
    private int failed;
    @Schema(description = "并发冲突人数（等级已被他处修改）/ Users lost to a concurrent rank change", example = "0")
    private int conflicts;
    private List<FailedUser> failedUsers = new ArrayList<>();

    @Data
    public static class FailedUser {
        private Long userId;
        private String reason;

        public FailedUser(Long userId, String reason) {
            this.userId = userId;
            this.reason = reason;
        }
    }
}
