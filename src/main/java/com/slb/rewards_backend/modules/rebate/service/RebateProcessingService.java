package com.slb.rewards_backend.modules.rebate.service;

import com.slb.rewards_backend.common.trace.TraceIdHolder;
import com.slb.rewards_backend.modules.rank.service.RankAdvancementService;
import com.slb.rewards_backend.modules.rebate.config.RebateProperties;
import com.slb.rewards_backend.modules.rebate.mapper.RebateMapper;
import com.slb.rewards_backend.modules.rebate.vo.RebateProcessSummaryVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * pending 返利批量入账。
 * <p>
 * 每条返利在独立事务中处理（{@link RebateTxService}），status='pending' 条件更新即为抢占，
 * 因此可以重复执行，也可以与自身并发执行，不会重复加款。单条失败只影响该条。
 * 锁等待超时、死锁、连接中断等存储层暂时性异常不标记 failed，行保持 pending 由下次执行重试。
 */
@Slf4j
@Service
public class RebateProcessingService {

    private final RebateMapper rebateMapper;
    private final RebateTxService rebateTxService;
    private final RankAdvancementService rankAdvancementService;
    private final RebateProperties rebateProperties;
    private final boolean enabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RebateProcessingService(RebateMapper rebateMapper,
                                   RebateTxService rebateTxService,
                                   RankAdvancementService rankAdvancementService,
                                   RebateProperties rebateProperties,
                                   @Value("${app.rebate.process-enabled:false}") boolean enabled) {
        this.rebateMapper = rebateMapper;
        this.rebateTxService = rebateTxService;
        this.rankAdvancementService = rankAdvancementService;
        this.rebateProperties = rebateProperties;
        this.enabled = enabled;
    }

    public RebateProcessSummaryVo processPendingRebates() {
        RebateProcessSummaryVo summary = new RebateProcessSummaryVo();
        Set<Long> creditedReceivers = new LinkedHashSet<>();
        int batchSize = Math.max(1, rebateProperties.getProcessBatchSize());
        long lastId = 0L;
        while (true) {
            List<Long> ids = rebateMapper.selectPendingIdsAfter(lastId, batchSize);
            if (ids.isEmpty()) {
                break;
            }
            for (Long id : ids) {
                processSingle(id, summary, creditedReceivers);
            }
            lastId = ids.get(ids.size() - 1);
        }

        if (rebateProperties.isEvaluateRanksAfterProcessing()) {
            for (Long receiverId : creditedReceivers) {
                try {
                    rankAdvancementService.processAdvancement(receiverId);
                    summary.setRanksEvaluated(summary.getRanksEvaluated() + 1);
                } catch (Exception ex) {
                    log.warn("Rank re-evaluation after rebate processing failed (userId={}): {}", receiverId, ex.getMessage());
                }
            }
        }

        log.info("Rebate processing finished (processed={}, failed={}, skipped={}, retryable={}, totalCredited={})",
                summary.getProcessed(), summary.getFailed(), summary.getSkipped(), summary.getRetryable(),
                summary.getTotalCredited());
        return summary;
    }

    private void processSingle(Long id, RebateProcessSummaryVo summary, Set<Long> creditedReceivers) {
        try {
            RebateTxService.ProcessResult result = rebateTxService.processOne(id);
            if (result.credited()) {
                summary.setProcessed(summary.getProcessed() + 1);
                summary.setTotalCredited(summary.getTotalCredited().add(result.amount()));
                creditedReceivers.add(result.receiverId());
            } else {
                summary.setSkipped(summary.getSkipped() + 1);
            }
        } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
            // 事务已回滚，行仍为 pending
            summary.setRetryable(summary.getRetryable() + 1);
            log.warn("Transient store error, rebate left pending for retry (rebateId={}): {}", id, ex.getMessage());
        } catch (Exception ex) {
            String reason = truncate(ex.getClass().getSimpleName() + ": " + ex.getMessage());
            log.error("Failed to process rebate (rebateId={}): {}", id, reason);
            try {
                if (rebateTxService.markFailed(id, reason)) {
                    summary.setFailed(summary.getFailed() + 1);
                    summary.getFailedItems().add(new RebateProcessSummaryVo.FailedItem(id, reason));
                } else {
                    summary.setSkipped(summary.getSkipped() + 1);
                }
            } catch (Exception markEx) {
                // 行保持 pending，下次执行会再次处理
                log.error("Failed to mark rebate as failed, left pending (rebateId={}): {}", id, markEx.getMessage());
            }
        }
    }

    /**
     * 定时入账 pending 返利；同一节点上不会重叠执行。
     */
    @Scheduled(cron = "${app.rebate.process-cron:0 */5 * * * ?}")
    public void processPendingRebatesJob() {
        if (!enabled) {
            log.debug("Rebate processing job is disabled (app.rebate.process-enabled=false), skip execution");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Rebate processing job is still running, skip this trigger");
            return;
        }
        TraceIdHolder.startJob("rebate-process");
        try {
            processPendingRebates();
        } catch (Exception ex) {
            log.error("Rebate processing job aborted: {}", ex.getMessage(), ex);
        } finally {
            TraceIdHolder.clear();
            running.set(false);
        }
    }

    private String truncate(String reason) {
        int max = Math.max(16, rebateProperties.getFailureReasonMaxLength());
        return reason.length() <= max ? reason : reason.substring(0, max);
    }
}
