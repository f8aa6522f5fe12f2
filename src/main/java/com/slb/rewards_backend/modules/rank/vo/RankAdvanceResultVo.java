package com.slb.rewards_backend.modules.rank.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "晋升结果 / Rank advancement result")
public class RankAdvanceResultVo {
    private Long userId;
    private boolean advanced;
    @Schema(description = "等级已被并发修改，本次未生效 / Lost the compare-and-set to a concurrent change")
    private boolean conflict;
    private RankVo previousRank;
    private RankVo newRank;
    private String message;
}
