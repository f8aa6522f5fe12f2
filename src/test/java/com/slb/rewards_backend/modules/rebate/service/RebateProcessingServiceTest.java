package com.slb.rewards_backend.modules.rebate.service;

import com.slb.rewards_backend.modules.genealogy.service.GenealogyService;
import com.slb.rewards_backend.modules.purchase.entity.Purchase;
import com.slb.rewards_backend.modules.purchase.mapper.PurchaseMapper;
import com.slb.rewards_backend.modules.rank.service.RankAdvancementService;
import com.slb.rewards_backend.modules.rebate.config.RebateProperties;
import com.slb.rewards_backend.modules.rebate.entity.Rebate;
import com.slb.rewards_backend.modules.rebate.entity.RebateConfig;
import com.slb.rewards_backend.modules.rebate.mapper.RebateConfigMapper;
import com.slb.rewards_backend.modules.rebate.mapper.RebateMapper;
import com.slb.rewards_backend.modules.rebate.vo.RebateProcessSummaryVo;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import com.slb.rewards_backend.modules.wallet.entity.WalletTransaction;
import com.slb.rewards_backend.modules.wallet.mapper.WalletTransactionMapper;
import com.slb.rewards_backend.modules.wallet.service.WalletLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 用内存中的 rebates / wallet_transactions / users 代替数据库，条件更新语义与 SQL 保持一致。
 */
class RebateProcessingServiceTest {

    private final Map<Long, Rebate> rebates = new ConcurrentHashMap<>();
    private final Map<String, WalletTransaction> ledger = new ConcurrentHashMap<>();
    private final Map<Long, BigDecimal> balances = new ConcurrentHashMap<>();
    private final AtomicLong ledgerIds = new AtomicLong();
    private final AtomicBoolean balanceRowLocked = new AtomicBoolean(false);

    private RebateMapper rebateMapper;
    private UserMapper userMapper;
    private RankAdvancementService rankAdvancementService;
    private RebateProperties properties;
    private RebateProcessingService service;

    @BeforeEach
    void setup() {
        rebateMapper = mock(RebateMapper.class);
        userMapper = mock(UserMapper.class);
        WalletTransactionMapper walletTransactionMapper = mock(WalletTransactionMapper.class);
        rankAdvancementService = mock(RankAdvancementService.class);

        when(rebateMapper.selectPendingIdsAfter(any(), anyInt())).thenAnswer(inv -> {
            Long afterId = inv.getArgument(0);
            int limit = inv.getArgument(1);
            return rebates.values().stream()
                    .filter(r -> "pending".equals(r.getStatus()) && r.getId() > afterId)
                    .map(Rebate::getId)
                    .sorted()
                    .limit(limit)
                    .toList();
        });
        when(rebateMapper.selectById(anyLong())).thenAnswer(inv -> Optional.ofNullable(rebates.get(inv.<Long>getArgument(0))).map(RebateProcessingServiceTest::copy));
        when(rebateMapper.claimPending(anyLong(), any())).thenAnswer(inv -> transition(inv.getArgument(0), "processed"));
        when(rebateMapper.markFailed(anyLong(), anyString())).thenAnswer(inv -> {
            int changed = transition(inv.getArgument(0), "failed");
            if (changed == 1) {
                rebates.get(inv.<Long>getArgument(0)).setFailureReason(inv.getArgument(1));
            }
            return changed;
        });
        when(rebateMapper.linkWalletTransaction(anyLong(), anyLong())).thenAnswer(inv -> {
            rebates.get(inv.<Long>getArgument(0)).setWalletTransactionId(inv.getArgument(1));
            return 1;
        });

        when(walletTransactionMapper.insertIgnore(any())).thenAnswer(inv -> {
            WalletTransaction tx = inv.getArgument(0);
            tx.setId(ledgerIds.incrementAndGet());
            return ledger.putIfAbsent(tx.getRefType() + ":" + tx.getRefId(), tx) == null ? 1 : 0;
        });
        when(walletTransactionMapper.selectByRef(anyString(), anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(ledger.get(inv.getArgument(0) + ":" + inv.getArgument(1))));
        when(userMapper.incrementWalletBalance(anyLong(), any())).thenAnswer(inv -> {
            Long userId = inv.getArgument(0);
            if (balanceRowLocked.get()) {
                throw new CannotAcquireLockException("Lock wait timeout exceeded; try restarting transaction");
            }
            if (!balances.containsKey(userId)) {
                return 0;
            }
            balances.merge(userId, inv.getArgument(1), BigDecimal::add);
            return 1;
        });

        WalletLedgerService walletLedgerService = new WalletLedgerService(walletTransactionMapper, userMapper);
        RebateTxService txService = new RollbackOnErrorTxService(rebateMapper, walletLedgerService);
        properties = new RebateProperties();
        properties.setProcessBatchSize(7);
        service = new RebateProcessingService(rebateMapper, txService, rankAdvancementService, properties, true);
    }

    @Test
    void process_shouldCreditEachPendingRowAndLinkLedger() {
        balances.put(1L, BigDecimal.ZERO);
        balances.put(2L, BigDecimal.ZERO);
        addPending(1L, 2L, "100.00");
        addPending(2L, 1L, "50.00");

        RebateProcessSummaryVo summary = service.processPendingRebates();

        assertThat(summary.getProcessed()).isEqualTo(2);
        assertThat(summary.getFailed()).isZero();
        assertThat(summary.getTotalCredited()).isEqualByComparingTo("150.00");
        assertThat(balances.get(2L)).isEqualByComparingTo("100.00");
        assertThat(balances.get(1L)).isEqualByComparingTo("50.00");
        assertThat(rebates.values()).allSatisfy(r -> {
            assertThat(r.getStatus()).isEqualTo("processed");
            assertThat(r.getWalletTransactionId()).isNotNull();
        });
        assertThat(ledger).hasSize(2);
    }

    @Test
    void process_runTwice_shouldNotCreditAgain() {
        balances.put(2L, BigDecimal.ZERO);
        for (long id = 1; id <= 20; id++) {
            addPending(id, 2L, "1.00");
        }

        service.processPendingRebates();
        RebateProcessSummaryVo second = service.processPendingRebates();

        assertThat(second.getProcessed()).isZero();
        assertThat(second.getSkipped()).isZero();
        assertThat(balances.get(2L)).isEqualByComparingTo("20.00");
        assertThat(ledger).hasSize(20);
    }

    @Test
    void process_concurrentRuns_shouldCreditEachRowExactlyOnce() throws Exception {
        int receivers = 5;
        for (long u = 1; u <= receivers; u++) {
            balances.put(u, BigDecimal.ZERO);
        }
        int rows = 300;
        for (long id = 1; id <= rows; id++) {
            addPending(id, 1 + (id % receivers), "2.50");
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RebateProcessSummaryVo>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return service.processPendingRebates();
            }));
        }
        start.countDown();
        int processed = 0;
        for (Future<RebateProcessSummaryVo> f : futures) {
            RebateProcessSummaryVo summary = f.get(30, TimeUnit.SECONDS);
            assertThat(summary.getFailed()).isZero();
            processed += summary.getProcessed();
        }
        pool.shutdownNow();

        assertThat(processed).isEqualTo(rows);
        assertThat(ledger).hasSize(rows);
        BigDecimal total = balances.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total).isEqualByComparingTo(new BigDecimal("2.50").multiply(BigDecimal.valueOf(rows)));
        for (long u = 1; u <= receivers; u++) {
            assertThat(balances.get(u)).isEqualByComparingTo("150.00");
        }
    }

    @Test
    void process_failingRow_shouldBeMarkedFailedWithoutAffectingOthers() {
        balances.put(1L, BigDecimal.ZERO);
        addPending(1L, 1L, "10.00");
        // 收款用户 99 不存在，加余额影响 0 行
        addPending(2L, 99L, "20.00");
        addPending(3L, 1L, "30.00");

        RebateProcessSummaryVo summary = service.processPendingRebates();

        assertThat(summary.getProcessed()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getFailedItems()).extracting(RebateProcessSummaryVo.FailedItem::getRebateId).containsExactly(2L);
        assertThat(rebates.get(2L).getStatus()).isEqualTo("failed");
        assertThat(rebates.get(2L).getFailureReason()).contains("收款用户不存在");
        assertThat(balances.get(1L)).isEqualByComparingTo("40.00");

        // 失败行不会被再次处理
        RebateProcessSummaryVo again = service.processPendingRebates();
        assertThat(again.getProcessed()).isZero();
        assertThat(again.getFailed()).isZero();
    }

    @Test
    void process_markFailedThrows_shouldLeaveRowPending() {
        balances.put(1L, BigDecimal.ZERO);
        addPending(1L, 99L, "20.00");
        doThrow(new IllegalStateException("db down")).when(rebateMapper).markFailed(anyLong(), anyString());

        RebateProcessSummaryVo summary = service.processPendingRebates();

        assertThat(summary.getProcessed()).isZero();
        assertThat(summary.getFailed()).isZero();
        assertThat(rebates.get(1L).getStatus()).isEqualTo("pending");
    }

    @Test
    void process_lockTimeout_shouldLeaveRowPendingAndCreditOnNextRun() {
        balances.put(1L, BigDecimal.ZERO);
        addPending(1L, 1L, "20.00");
        balanceRowLocked.set(true);

        RebateProcessSummaryVo first = service.processPendingRebates();

        assertThat(first.getProcessed()).isZero();
        assertThat(first.getFailed()).isZero();
        assertThat(first.getRetryable()).isEqualTo(1);
        assertThat(first.getFailedItems()).isEmpty();
        assertThat(rebates.get(1L).getStatus()).isEqualTo("pending");
        assertThat(ledger).isEmpty();
        verify(rebateMapper, never()).markFailed(anyLong(), anyString());

        balanceRowLocked.set(false);
        RebateProcessSummaryVo second = service.processPendingRebates();

        assertThat(second.getProcessed()).isEqualTo(1);
        assertThat(second.getRetryable()).isZero();
        assertThat(rebates.get(1L).getStatus()).isEqualTo("processed");
        assertThat(balances.get(1L)).isEqualByComparingTo("20.00");
        assertThat(ledger).hasSize(1);
    }

    @Test
    void process_connectionLostOnOneRow_shouldContinueWithOthers() {
        balances.put(1L, BigDecimal.ZERO);
        addPending(1L, 1L, "10.00");
        addPending(2L, 1L, "20.00");
        doThrow(new DataAccessResourceFailureException("Communications link failure"))
                .when(rebateMapper).claimPending(eq(1L), any());

        RebateProcessSummaryVo summary = service.processPendingRebates();

        assertThat(summary.getProcessed()).isEqualTo(1);
        assertThat(summary.getRetryable()).isEqualTo(1);
        assertThat(summary.getFailed()).isZero();
        assertThat(rebates.get(1L).getStatus()).isEqualTo("pending");
        assertThat(balances.get(1L)).isEqualByComparingTo("20.00");
    }

    @Test
    void configEditedAfterProcessing_shouldNotChangeProcessedRebate() {
        PurchaseMapper purchaseMapper = mock(PurchaseMapper.class);
        RebateConfigMapper rebateConfigMapper = mock(RebateConfigMapper.class);
        GenealogyService genealogyService = mock(GenealogyService.class);
        AtomicReference<String> levelOnePercentage = new AtomicReference<>("10");
        AtomicLong rebateIds = new AtomicLong(100L);

        Purchase purchase = new Purchase();
        purchase.setId(900L);
        purchase.setUserId(3L);
        purchase.setProductId(7L);
        purchase.setTotalAmount(new BigDecimal("1000.00"));
        purchase.setStatus(Purchase.STATUS_COMPLETED);
        when(purchaseMapper.selectById(900L)).thenReturn(Optional.of(purchase));
        when(rebateConfigMapper.selectByProductId(7L)).thenAnswer(inv -> {
            RebateConfig config = new RebateConfig();
            config.setProductId(7L);
            config.setLevel(1);
            config.setRewardType("percentage");
            config.setPercentage(new BigDecimal(levelOnePercentage.get()));
            return List.of(config);
        });
        when(genealogyService.getUpline(3L, 1)).thenReturn(List.of(2L));
        // UNIQUE(purchase_id, level)
        when(rebateMapper.insertIgnore(any())).thenAnswer(inv -> {
            Rebate row = inv.getArgument(0);
            boolean exists = rebates.values().stream().anyMatch(r ->
                    r.getPurchaseId().equals(row.getPurchaseId()) && r.getLevel().equals(row.getLevel()));
            if (exists) {
                return 0;
            }
            row.setId(rebateIds.incrementAndGet());
            rebates.put(row.getId(), copy(row));
            return 1;
        });
        RebateCalculationService calculationService = new RebateCalculationService(
                purchaseMapper, rebateConfigMapper, rebateMapper, genealogyService, new RebateProperties());
        balances.put(2L, BigDecimal.ZERO);

        assertThat(calculationService.computeRebatesForPurchase(900L)).hasSize(1);
        assertThat(service.processPendingRebates().getProcessed()).isEqualTo(1);

        levelOnePercentage.set("20");
        assertThat(calculationService.computeRebatesForPurchase(900L)).isEmpty();
        RebateProcessSummaryVo rerun = service.processPendingRebates();

        assertThat(rerun.getProcessed()).isZero();
        assertThat(rebates).hasSize(1);
        Rebate stored = rebates.values().iterator().next();
        assertThat(stored.getStatus()).isEqualTo("processed");
        assertThat(stored.getAmount()).isEqualByComparingTo("100.00");
        assertThat(balances.get(2L)).isEqualByComparingTo("100.00");
        assertThat(ledger).hasSize(1);
    }

    @Test
    void process_evaluateRanksEnabled_shouldEvaluateEachCreditedReceiverOnce() {
        properties.setEvaluateRanksAfterProcessing(true);
        balances.put(1L, BigDecimal.ZERO);
        balances.put(2L, BigDecimal.ZERO);
        addPending(1L, 1L, "1.00");
        addPending(2L, 1L, "1.00");
        addPending(3L, 2L, "1.00");

        RebateProcessSummaryVo summary = service.processPendingRebates();

        assertThat(summary.getRanksEvaluated()).isEqualTo(2);
        verify(rankAdvancementService, times(1)).processAdvancement(1L);
        verify(rankAdvancementService, times(1)).processAdvancement(2L);
    }

    @Test
    void process_evaluateRanksDisabled_shouldNotTouchRanks() {
        balances.put(1L, BigDecimal.ZERO);
        addPending(1L, 1L, "1.00");

        service.processPendingRebates();

        verifyNoInteractions(rankAdvancementService);
    }

    /**
     * 模拟单条事务回滚：异常时恢复返利行并撤销本条流水。
     */
    private final class RollbackOnErrorTxService extends RebateTxService {

        RollbackOnErrorTxService(RebateMapper rebateMapper, WalletLedgerService walletLedgerService) {
            super(rebateMapper, walletLedgerService);
        }

        @Override
        public ProcessResult processOne(Long rebateId) {
            Rebate before = copy(rebates.get(rebateId));
            try {
                return super.processOne(rebateId);
            } catch (RuntimeException ex) {
                rebates.put(rebateId, before);
                ledger.remove(WalletLedgerService.REF_TYPE_REBATE + ":" + rebateId);
                throw ex;
            }
        }
    }

    private int transition(Long id, String target) {
        Set<Long> changed = ConcurrentHashMap.newKeySet();
        rebates.computeIfPresent(id, (k, r) -> {
            if ("pending".equals(r.getStatus())) {
                r.setStatus(target);
                changed.add(k);
            }
            return r;
        });
        return changed.isEmpty() ? 0 : 1;
    }

    private void addPending(Long id, Long receiverId, String amount) {
        Rebate r = new Rebate();
        r.setId(id);
        r.setPurchaseId(1000L + id);
        r.setGeneratorId(500L);
        r.setReceiverId(receiverId);
        r.setLevel(1);
        r.setRewardType("percentage");
        r.setAmount(new BigDecimal(amount));
        r.setStatus("pending");
        rebates.put(id, r);
    }

    private static Rebate copy(Rebate source) {
        Rebate r = new Rebate();
        r.setId(source.getId());
        r.setPurchaseId(source.getPurchaseId());
        r.setGeneratorId(source.getGeneratorId());
        r.setReceiverId(source.getReceiverId());
        r.setLevel(source.getLevel());
        r.setRewardType(source.getRewardType());
        r.setAmount(source.getAmount());
        r.setStatus(source.getStatus());
        return r;
    }
}
