package com.slb.rewards_backend.modules.rebate.service;

import com.slb.rewards_backend.modules.rebate.entity.Rebate;
import com.slb.rewards_backend.modules.rebate.enums.RebateStatus;
import com.slb.rewards_backend.modules.rebate.mapper.RebateMapper;
import com.slb.rewards_backend.modules.wallet.service.WalletLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 单条返利入账的事务实现（确保 @Transactional 真实生效：public 方法 + 由外部 Bean 调用）。
 */
@Service
@Slf4j
public class RebateTxService {

    private final RebateMapper rebateMapper;
    private final WalletLedgerService walletLedgerService;

    public RebateTxService(RebateMapper rebateMapper, WalletLedgerService walletLedgerService) {
        this.rebateMapper = rebateMapper;
        this.walletLedgerService = walletLedgerService;
    }

    /**
     * 抢占 -> 原子加余额 -> 写流水 -> 回写流水ID，在同一事务内完成。
     * 任一步失败整体回滚，返利行回到 pending，由调用方标记 failed。
     *
     * @return 抢占失败（已被其他执行者处理或已不是 pending）时返回 {@link ProcessResult#skipped()}
     */
    @Transactional
    public ProcessResult processOne(Long rebateId) {
        Rebate rebate = rebateMapper.selectById(rebateId).orElse(null);
        if (rebate == null || !RebateStatus.PENDING.code().equals(rebate.getStatus())) {
            return ProcessResult.skipped();
        }
        if (rebateMapper.claimPending(rebateId, LocalDateTime.now()) == 0) {
            log.debug("Rebate already claimed by another worker (rebateId={})", rebateId);
            return ProcessResult.skipped();
        }
        if (rebate.getAmount() == null || rebate.getAmount().signum() < 0) {
            throw new IllegalStateException("返利金额非法: " + rebate.getAmount());
        }
        String description = "Rebate from level " + rebate.getLevel() + " purchase #" + rebate.getPurchaseId();
        Long walletTxId = walletLedgerService.creditRebate(rebate.getReceiverId(), rebate.getAmount(), rebateId, description);
        rebateMapper.linkWalletTransaction(rebateId, walletTxId);
        return new ProcessResult(true, rebate.getReceiverId(), rebate.getAmount());
    }

    /**
     * 标记失败（仅当仍为 pending）。在 processOne 回滚之后调用。
     *
     * @return 是否由本次调用完成 pending -> failed
     */
    @Transactional
    public boolean markFailed(Long rebateId, String reason) {
        return rebateMapper.markFailed(rebateId, reason) > 0;
    }

    public record ProcessResult(boolean credited, Long receiverId, BigDecimal amount) {
        public static ProcessResult skipped() {
            return new ProcessResult(false, null, BigDecimal.ZERO);
        }
    }
}
