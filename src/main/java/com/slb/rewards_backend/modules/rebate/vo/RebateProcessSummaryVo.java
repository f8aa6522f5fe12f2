package com.slb.rewards_backend.modules.rebate.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "返利入账批处理结果 / Rebate processing summary")
public class RebateProcessSummaryVo {
    @Schema(description = "本次入账成功条数 / Rows credited by this run", example = "12")
    private int processed;
    @Schema(description = "本次标记失败条数 / Rows marked failed by this run", example = "1")
    private int failed;
    @Schema(description = "已被其他执行者处理而跳过的条数 / Rows lost to a concurrent claim", example = "0")
    private int skipped;
    @Schema(description = "存储暂时不可用、保持 pending 待下次重试的条数 / Rows left pending after a transient store error", example = "0")
    private int retryable;
    @Schema(description = "本次入账总金额 / Total amount credited", example = "350.00")
    private BigDecimal totalCredited = BigDecimal.ZERO;
    @Schema(description = "失败明细 / Failed rows")
    private List<FailedItem> failedItems = new ArrayList<>();
    @Schema(description = "完成等级评估的收款人数 / Receivers re-evaluated for rank", example = "3")
    private int ranksEvaluated;

    @Data
    public static class FailedItem {
        private Long rebateId;
        private String reason;

        public FailedItem(Long rebateId, String reason) {
            this.rebateId = rebateId;
            this.reason = reason;
        }
    }
}
