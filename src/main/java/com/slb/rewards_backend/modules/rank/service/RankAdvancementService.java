package com.slb.rewards_backend.modules.rank.service;

import com.google.common.collect.Lists;
import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.common.trace.TraceIdHolder;
import com.slb.rewards_backend.common.vo.PageVo;
import com.slb.rewards_backend.modules.genealogy.service.GenealogyService;
import com.slb.rewards_backend.modules.purchase.mapper.PurchaseMapper;
import com.slb.rewards_backend.modules.rank.config.RankProperties;
import com.slb.rewards_backend.modules.rank.mapper.RankAdvancementMapper;
import com.slb.rewards_backend.modules.rank.mapper.RankMapper;
import com.slb.rewards_backend.modules.rank.vo.RankAdvanceResultVo;
import com.slb.rewards_backend.modules.rank.vo.RankAdvancementVo;
import com.slb.rewards_backend.modules.rank.vo.RankBatchSummaryVo;
import com.slb.rewards_backend.modules.rank.vo.RankEligibilityVo;
import com.slb.rewards_backend.modules.rank.vo.RankVo;
import com.slb.rewards_backend.modules.rank.vo.RequirementCheckVo;
import com.slb.rewards_backend.modules.users.entity.User;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 等级晋升状态机：只能从当前等级晋升到 level+1，不降级。
 * <p>
 * 资格评估读的是普通快照数据，可能与并发中的下级变动存在时差；晋升写入以 rank_id 的 CAS 为准，
 * 并发晋升只会有一个成功，另一个记为冲突。
 */
@Slf4j
@Service
public class RankAdvancementService {

    public static final String PERSONAL_SALES = "PERSONAL_SALES";
    public static final String GROUP_SALES = "GROUP_SALES";
    public static final String DIRECT_DOWNLINE = "DIRECT_DOWNLINE";
    public static final String QUALIFIED_DOWNLINE = "QUALIFIED_DOWNLINE";
    public static final String REQUIREMENTS_NOT_CONFIGURED = "REQUIREMENTS_NOT_CONFIGURED";
    public static final String UNKNOWN_CURRENT_RANK = "UNKNOWN_CURRENT_RANK";

    private static final int ID_CHUNK = 1000;

    private final UserMapper userMapper;
    private final PurchaseMapper purchaseMapper;
    private final RankMapper rankMapper;
    private final RankAdvancementMapper rankAdvancementMapper;
    private final RankService rankService;
    private final RankAdvancementTxService txService;
    private final GenealogyService genealogyService;
    private final RankProperties rankProperties;
    private final boolean enabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RankAdvancementService(UserMapper userMapper,
                                  PurchaseMapper purchaseMapper,
                                  RankMapper rankMapper,
                                  RankAdvancementMapper rankAdvancementMapper,
                                  RankService rankService,
                                  RankAdvancementTxService txService,
                                  GenealogyService genealogyService,
                                  RankProperties rankProperties,
                                  @Value("${app.rank.process-enabled:false}") boolean enabled) {
        this.userMapper = userMapper;
        this.purchaseMapper = purchaseMapper;
        this.rankMapper = rankMapper;
        this.rankAdvancementMapper = rankAdvancementMapper;
        this.rankService = rankService;
        this.txService = txService;
        this.genealogyService = genealogyService;
        this.rankProperties = rankProperties;
        this.enabled = enabled;
    }

    public RankEligibilityVo checkEligibility(Long userId) {
        User user = userMapper.selectById(userId)
                .orElseThrow(() -> BizException.notFound("用户不存在: " + userId));
        List<RankVo> ladder = ladderContaining(user.getRankId());
        RankVo current = findRank(ladder, user.getRankId());

        RankEligibilityVo vo = new RankEligibilityVo();
        vo.setUserId(userId);
        if (user.getRankId() != null && current == null) {
            // 不按无等级处理，否则会按 level 1 评估并与 CAS 条件冲突
            log.warn("User references a rank missing from the ladder, advancement blocked (userId={}, rankId={})",
                    userId, user.getRankId());
            vo.setEligible(false);
            vo.getMissingRequirements().add(UNKNOWN_CURRENT_RANK);
            vo.setMessage("当前等级不存在于等级阶梯: rankId=" + user.getRankId());
            return vo;
        }
        int currentLevel = current == null ? 0 : current.getLevel();
        RankVo next = ladder.stream()
                .filter(r -> r.getLevel() != null && r.getLevel() == currentLevel + 1)
                .findFirst()
                .orElse(null);
        vo.setCurrentRank(current);
        vo.setNextRank(next);
        if (next == null) {
            vo.setEligible(false);
            vo.setMessage("已是最高等级");
            return vo;
        }
        if (!next.isRequirementsConfigured()) {
            log.warn("Rank requirements are not configured, advancement blocked (rankId={}, level={})", next.getId(), next.getLevel());
            vo.setEligible(false);
            vo.getMissingRequirements().add(REQUIREMENTS_NOT_CONFIGURED);
            vo.setMessage("等级 " + next.getName() + " 未配置晋升门槛");
            return vo;
        }

        long directCount = genealogyService.countDirectDownline(userId);
        List<Long> downline = genealogyService.getEntireDownlineIds(userId);
        BigDecimal personalSales = nz(purchaseMapper.sumCompletedAmountByUserIds(List.of(userId)));
        BigDecimal groupSales = personalSales;
        for (List<Long> chunk : Lists.partition(downline, ID_CHUNK)) {
            groupSales = groupSales.add(nz(purchaseMapper.sumCompletedAmountByUserIds(chunk)));
        }
        long qualifiedCount = 0L;
        int requiredQualified = nz(next.getRequiredQualifiedDownline());
        if (requiredQualified > 0 && next.getQualifiedRankId() != null) {
            RankVo qualifiedRank = ladder.stream()
                    .filter(r -> next.getQualifiedRankId().equals(r.getId()))
                    .findFirst()
                    .orElseThrow(() -> BizException.invalidConfig("合格下级等级不存在: " + next.getQualifiedRankId()));
            for (List<Long> chunk : Lists.partition(downline, ID_CHUNK)) {
                qualifiedCount += rankMapper.countUsersAtOrAboveLevel(chunk, qualifiedRank.getLevel());
            }
        }

        vo.setPersonalSales(personalSales);
        vo.setGroupSales(groupSales);
        vo.setDirectDownlineCount(directCount);
        vo.setQualifiedDownlineCount(qualifiedCount);

        addCheck(vo, PERSONAL_SALES, nz(next.getRequiredPersonalSales()), personalSales);
        addCheck(vo, GROUP_SALES, nz(next.getRequiredGroupSales()), groupSales);
        addCheck(vo, DIRECT_DOWNLINE, BigDecimal.valueOf(nz(next.getRequiredDirectDownline())), BigDecimal.valueOf(directCount));
        if (requiredQualified > 0 && next.getQualifiedRankId() != null) {
            addCheck(vo, QUALIFIED_DOWNLINE, BigDecimal.valueOf(requiredQualified), BigDecimal.valueOf(qualifiedCount));
        }

        vo.setEligible(vo.getMissingRequirements().isEmpty());
        vo.setMessage(vo.isEligible()
                ? "已满足晋升 " + next.getName() + " 的全部条件"
                : "尚未满足晋升 " + next.getName() + " 的条件");
        return vo;
    }

    /**
     * 缓存的阶梯里找不到 rankId 时清缓存重读一次（后台新增等级后缓存最多滞后一小时）。
     */
    private List<RankVo> ladderContaining(Long rankId) {
        List<RankVo> ladder = rankService.getLadder();
        if (rankId == null || findRank(ladder, rankId) != null) {
            return ladder;
        }
        log.info("Rank not found in cached ladder, reloading (rankId={})", rankId);
        rankService.evictLadderCache();
        return rankService.getLadder();
    }

    private static RankVo findRank(List<RankVo> ladder, Long rankId) {
        if (rankId == null) {
            return null;
        }
        return ladder.stream()
                .filter(r -> rankId.equals(r.getId()))
                .findFirst()
                .orElse(null);
    }

    /**
     * 满足条件则晋升一级；不满足或 CAS 冲突都不是错误，只在结果中体现。
     */
    public RankAdvanceResultVo processAdvancement(Long userId) {
        RankEligibilityVo eligibility = checkEligibility(userId);
        RankAdvanceResultVo result = new RankAdvanceResultVo();
        result.setUserId(userId);
        result.setPreviousRank(eligibility.getCurrentRank());
        if (!eligibility.isEligible() || eligibility.getNextRank() == null) {
            result.setAdvanced(false);
            result.setMessage(eligibility.getMessage());
            return result;
        }

        Long expectedRankId = eligibility.getCurrentRank() == null ? null : eligibility.getCurrentRank().getId();
        RankVo next = eligibility.getNextRank();
        boolean advanced = txService.advance(userId, expectedRankId, next.getId(), eligibility);
        result.setAdvanced(advanced);
        result.setConflict(!advanced);
        if (advanced) {
            result.setNewRank(next);
            result.setMessage("晋升为 " + next.getName());
            log.info("Rank advanced (userId={}, fromRankId={}, toRankId={}, level={})",
                    userId, expectedRankId, next.getId(), next.getLevel());
        } else {
            result.setMessage("等级已被并发修改，本次未晋升");
        }
        return result;
    }

    public RankBatchSummaryVo processAllRankAdvancements() {
        RankBatchSummaryVo summary = new RankBatchSummaryVo();
        int batchSize = Math.max(1, rankProperties.getUserBatchSize());
        long lastId = 0L;
        while (true) {
            List<Long> ids = userMapper.selectIdsAfter(lastId, batchSize);
            if (ids.isEmpty()) {
                break;
            }
            for (Long id : ids) {
                summary.setProcessed(summary.getProcessed() + 1);
                try {
                    RankAdvanceResultVo result = processAdvancement(id);
                    if (result.isAdvanced()) {
                        summary.setAdvanced(summary.getAdvanced() + 1);
                    } else if (result.isConflict()) {
                        summary.setConflicts(summary.getConflicts() + 1);
                    }
                } catch (Exception ex) {
                    log.warn("Rank advancement failed (userId={}): {}", id, ex.getMessage());
                    summary.setFailed(summary.getFailed() + 1);
                    if (summary.getFailedUsers().size() < rankProperties.getMaxFailureDetails()) {
                        summary.getFailedUsers().add(new RankBatchSummaryVo.FailedUser(id, ex.getMessage()));
                    }
                }
            }
            lastId = ids.get(ids.size() - 1);
        }
        log.info("Rank advancement batch finished (processed={}, advanced={}, failed={}, conflicts={})",
                summary.getProcessed(), summary.getAdvanced(), summary.getFailed(), summary.getConflicts());
        return summary;
    }

    public List<RankAdvancementVo> getHistory(Long userId) {
        userMapper.selectById(userId).orElseThrow(() -> BizException.notFound("用户不存在: " + userId));
        return rankAdvancementMapper.selectByUserId(userId).stream().map(RankAdvancementVo::from).toList();
    }

    public PageVo<RankAdvancementVo> listAdvancements(int page, int size) {
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(size, 1), 100);
        long total = rankAdvancementMapper.countAll();
        if (total == 0) {
            return new PageVo<>(0L, safePage, safeSize, List.of());
        }
        List<RankAdvancementVo> list = rankAdvancementMapper.selectPage((safePage - 1) * safeSize, safeSize)
                .stream().map(RankAdvancementVo::from).toList();
        return new PageVo<>(total, safePage, safeSize, list);
    }

    /**
     * 定时全量晋升评估；同一节点上不会重叠执行。
     */
    @Scheduled(cron = "${app.rank.process-cron:0 30 2 * * ?}")
    public void processAllRankAdvancementsJob() {
        if (!enabled) {
            log.debug("Rank advancement job is disabled (app.rank.process-enabled=false), skip execution");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Rank advancement job is still running, skip this trigger");
            return;
        }
        TraceIdHolder.startJob("rank-process");
        try {
            processAllRankAdvancements();
        } catch (Exception ex) {
            log.error("Rank advancement job aborted: {}", ex.getMessage(), ex);
        } finally {
            TraceIdHolder.clear();
            running.set(false);
        }
    }

    private static void addCheck(RankEligibilityVo vo, String name, BigDecimal required, BigDecimal actual) {
        boolean met = actual.compareTo(required) >= 0;
        vo.getChecks().add(new RequirementCheckVo(name, required, actual, met));
        if (!met) {
            vo.getMissingRequirements().add(name);
        }
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }
}
