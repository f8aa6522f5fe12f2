package com.slb.rewards_backend.modules.binary.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "月结结果 / Monthly snapshot summary")
public class MonthlySnapshotSummaryVo {
    private Integer year;
    private Integer month;
    @Schema(description = "写入业绩行的用户数 / Users written", example = "1200")
    private int processed;
    @Schema(description = "安置数据异常被跳过的用户数 / Users skipped for malformed placement", example = "2")
    private int skipped;
    @Schema(description = "计算或写入失败的用户数 / Users failed", example = "0")
    private int failed;
    private String status;
    private List<UserIssue> skippedUsers = new ArrayList<>();
    private List<UserIssue> failedUsers = new ArrayList<>();
    @Schema(description = "本次写入的业绩行，仅 includeRows=true 时返回 / Rows written, only when requested")
    private List<MonthlyPerformanceVo> rows;
    private LocalDateTime startedTime;
    private LocalDateTime finishedTime;

    @Data
    public static class UserIssue {
        private Long userId;
        private String reason;

        public UserIssue(Long userId, String reason) {
            this.userId = userId;
            this.reason = reason;
        }
    }
}
