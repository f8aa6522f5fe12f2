package com.slb.rewards_backend.modules.genealogy.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 直属下级分页过滤条件。sortBy 只接受白名单字段，其余一律回退为默认排序。
 */
@Data
@Schema(description = "直属下级过滤条件 / Direct downline filter")
public class DownlineFilter {

    @Schema(description = "等级ID / Rank id", example = "2")
    private Long rankId;

    @Schema(description = "姓名或邮箱关键字 / Name or email keyword", example = "alice")
    private String keyword;

    @Schema(description = "加入时间下限（含）/ Joined at or after", example = "2025-01-01T00:00:00")
    private LocalDateTime joinedAfter;

    @Schema(description = "排序字段：createTime / name / id", example = "createTime")
    private String sortBy;

    @Schema(description = "排序方向：asc / desc", example = "asc")
    private String sortDir;
}
