package com.slb.rewards_backend.modules.binary.service;

import com.google.common.collect.Lists;
import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.common.trace.TraceIdHolder;
import com.slb.rewards_backend.modules.binary.config.BinaryPlanProperties;
import com.slb.rewards_backend.modules.binary.entity.MonthlyCutoff;
import com.slb.rewards_backend.modules.binary.entity.MonthlyPerformance;
import com.slb.rewards_backend.modules.binary.mapper.MonthlyCutoffMapper;
import com.slb.rewards_backend.modules.binary.repository.BinaryVolumeRepository;
import com.slb.rewards_backend.modules.binary.repository.PlacementNode;
import com.slb.rewards_backend.modules.binary.vo.MonthlyPerformanceVo;
import com.slb.rewards_backend.modules.binary.vo.MonthlySnapshotSummaryVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 双轨制月结：加载全量安置关系与本期 PV，内存计算后按 (user_id, year, month) upsert。
 * 同一周期重复执行结果一致（整行覆盖）。
 */
@Slf4j
@Service
public class MonthlySnapshotService {

    private static final int MAX_NOTES_LENGTH = 1000;

    private final BinaryVolumeRepository volumeRepository;
    private final MonthlyCutoffMapper cutoffMapper;
    private final BinaryCommissionCalculator calculator;
    private final BinaryPlanProperties plan;
    private final boolean enabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MonthlySnapshotService(BinaryVolumeRepository volumeRepository,
                                  MonthlyCutoffMapper cutoffMapper,
                                  BinaryCommissionCalculator calculator,
                                  BinaryPlanProperties plan,
                                  @Value("${app.binary.snapshot-enabled:false}") boolean enabled) {
        this.volumeRepository = volumeRepository;
        this.cutoffMapper = cutoffMapper;
        this.calculator = calculator;
        this.plan = plan;
        this.enabled = enabled;
    }

    public MonthlySnapshotSummaryVo runMonthlySnapshot(int year, int month, boolean includeRows) {
        if (month < 1 || month > 12) {
            throw new BizException("month 必须在 1..12 之间");
        }
        if (year < 2000 || year > 2100) {
            throw new BizException("year 超出范围: " + year);
        }
        YearMonth period = YearMonth.of(year, month);
        LocalDateTime start = period.atDay(1).atStartOfDay();
        LocalDateTime end = period.plusMonths(1).atDay(1).atStartOfDay();

        MonthlyCutoff cutoff = new MonthlyCutoff();
        cutoff.setYear(year);
        cutoff.setMonth(month);
        cutoff.setStatus(MonthlyCutoff.STATUS_PROCESSING);
        cutoff.setStartedTime(LocalDateTime.now());
        cutoffMapper.upsertProcessing(cutoff);

        MonthlySnapshotSummaryVo summary = new MonthlySnapshotSummaryVo();
        summary.setYear(year);
        summary.setMonth(month);
        summary.setStartedTime(cutoff.getStartedTime());
        try {
            List<PlacementNode> nodes = volumeRepository.loadPlacementNodes();
            Map<Long, BigDecimal> personalPv = volumeRepository.sumPersonalPvBetween(start, end);
            BinaryCommissionCalculator.Result result = calculator.compute(year, month, nodes, personalPv, start, end, plan);

            result.skipped().forEach((userId, reason) ->
                    summary.getSkippedUsers().add(new MonthlySnapshotSummaryVo.UserIssue(userId, reason)));
            result.failed().forEach((userId, reason) ->
                    summary.getFailedUsers().add(new MonthlySnapshotSummaryVo.UserIssue(userId, reason)));
            if (!result.skipped().isEmpty()) {
                log.warn("Monthly snapshot skipped users with malformed placement (period={}, count={}, sample={})",
                        period, result.skipped().size(), summary.getSkippedUsers().subList(0, Math.min(10, summary.getSkippedUsers().size())));
            }

            int written = 0;
            for (List<MonthlyPerformance> chunk : Lists.partition(result.rows(), Math.max(1, plan.getWriteBatchSize()))) {
                try {
                    volumeRepository.upsertPerformance(chunk);
                    written += chunk.size();
                } catch (RuntimeException ex) {
                    log.error("Monthly performance batch write failed (period={}, size={}): {}", period, chunk.size(), ex.getMessage());
                    for (MonthlyPerformance row : chunk) {
                        summary.getFailedUsers().add(new MonthlySnapshotSummaryVo.UserIssue(row.getUserId(), "write failed: " + ex.getMessage()));
                    }
                }
            }
            summary.setProcessed(written);
            summary.setSkipped(result.skipped().size());
            summary.setFailed(summary.getFailedUsers().size());
            if (includeRows) {
                summary.setRows(result.rows().stream().map(MonthlyPerformanceVo::from).toList());
            }
            boolean allFailed = written == 0 && summary.getFailed() > 0;
            finish(cutoff, summary, allFailed ? MonthlyCutoff.STATUS_FAILED : MonthlyCutoff.STATUS_COMPLETED, null);
        } catch (RuntimeException ex) {
            log.error("Monthly snapshot aborted (period={}): {}", period, ex.getMessage(), ex);
            finish(cutoff, summary, MonthlyCutoff.STATUS_FAILED, ex.getMessage());
            throw ex;
        }
        log.info("Monthly snapshot finished (period={}, processed={}, skipped={}, failed={})",
                period, summary.getProcessed(), summary.getSkipped(), summary.getFailed());
        return summary;
    }

    private void finish(MonthlyCutoff cutoff, MonthlySnapshotSummaryVo summary, String status, String error) {
        cutoff.setStatus(status);
        cutoff.setProcessedUsers(summary.getProcessed());
        cutoff.setSkippedUsers(summary.getSkipped());
        cutoff.setFailedUsers(summary.getFailed());
        cutoff.setFinishedTime(LocalDateTime.now());
        String notes = error != null ? "aborted: " + error
                : summary.getSkippedUsers().isEmpty() ? null : "skipped: " + summary.getSkippedUsers();
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            notes = notes.substring(0, MAX_NOTES_LENGTH);
        }
        cutoff.setNotes(notes);
        summary.setStatus(status);
        summary.setFinishedTime(cutoff.getFinishedTime());
        try {
            cutoffMapper.updateFinished(cutoff);
        } catch (RuntimeException ex) {
            log.error("Failed to record monthly cutoff result (period={}-{}, status={}): {}",
                    cutoff.getYear(), cutoff.getMonth(), status, ex.getMessage());
        }
    }

    /**
     * 每月 1 日结算上一个自然月；同一节点上不会重叠执行。
     */
    @Scheduled(cron = "${app.binary.snapshot-cron:0 30 0 1 * ?}")
    public void monthlySnapshotJob() {
        if (!enabled) {
            log.debug("Monthly snapshot job is disabled (app.binary.snapshot-enabled=false), skip execution");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Monthly snapshot job is still running, skip this trigger");
            return;
        }
        TraceIdHolder.startJob("binary-snapshot");
        try {
            YearMonth previous = YearMonth.now().minusMonths(1);
            runMonthlySnapshot(previous.getYear(), previous.getMonthValue(), false);
        } catch (Exception ex) {
            log.error("Monthly snapshot job failed: {}", ex.getMessage(), ex);
        } finally {
            TraceIdHolder.clear();
            running.set(false);
        }
    }
}
