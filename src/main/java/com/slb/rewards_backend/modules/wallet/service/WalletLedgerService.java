package com.slb.rewards_backend.modules.wallet.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.common.vo.PageVo;
import com.slb.rewards_backend.modules.users.entity.User;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import com.slb.rewards_backend.modules.wallet.entity.WalletTransaction;
import com.slb.rewards_backend.modules.wallet.mapper.WalletTransactionMapper;
import com.slb.rewards_backend.modules.wallet.vo.WalletTransactionVo;
import com.slb.rewards_backend.modules.wallet.vo.WalletVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class WalletLedgerService {

    public static final String REF_TYPE_REBATE = "rebate";

    private final WalletTransactionMapper walletTransactionMapper;
    private final UserMapper userMapper;

    public WalletLedgerService(WalletTransactionMapper walletTransactionMapper, UserMapper userMapper) {
        this.walletTransactionMapper = walletTransactionMapper;
        this.userMapper = userMapper;
    }

    /**
     * 返利入账：写流水 + 原子增加余额，必须运行在调用方（单条返利处理）的事务内。
     * <p>
     * 流水先写：(ref_type, ref_id) 已存在说明该返利已入过账，直接返回已有流水 ID，不再重复加余额。
     *
     * @param rebateId 关联的 rebates.id
     * @return 流水 ID
     * @throws BizException 收款用户不存在（404），由调用方回滚并标记失败
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Long creditRebate(Long userId, BigDecimal amount, Long rebateId, String description) {
        WalletTransaction tx = new WalletTransaction();
        tx.setUserId(userId);
        tx.setAmount(amount);
        tx.setType(WalletTransaction.TYPE_REBATE);
        tx.setRefType(REF_TYPE_REBATE);
        tx.setRefId(rebateId);
        tx.setStatus(WalletTransaction.STATUS_COMPLETED);
        tx.setDescription(description);
        tx.setCreateTime(LocalDateTime.now());
        // 幂等写入：依赖数据库唯一键避免重复入账（重复时返回 0）
        int inserted = walletTransactionMapper.insertIgnore(tx);
        if (inserted == 0) {
            log.warn("Wallet ledger already exists for rebate, skip balance increment (rebateId={}, userId={})", rebateId, userId);
            return walletTransactionMapper.selectByRef(REF_TYPE_REBATE, rebateId)
                    .map(WalletTransaction::getId)
                    .orElseThrow(() -> new IllegalStateException("wallet ledger vanished for rebate " + rebateId));
        }
        int updated = userMapper.incrementWalletBalance(userId, amount);
        if (updated == 0) {
            throw BizException.notFound("收款用户不存在: " + userId);
        }
        return tx.getId();
    }

    /**
     * 钱包余额 + 流水分页（按时间倒序）。
     */
    public WalletVo getWallet(Long userId, int page, int size) {
        User user = userMapper.selectById(userId)
                .orElseThrow(() -> BizException.notFound("用户不存在: " + userId));
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(size, 1), 100);

        long total = walletTransactionMapper.countByUserId(userId);
        List<WalletTransactionVo> list = total == 0
                ? List.of()
                : walletTransactionMapper.selectPageByUserId(userId, (safePage - 1) * safeSize, safeSize)
                        .stream().map(WalletTransactionVo::from).toList();

        WalletVo vo = new WalletVo();
        vo.setUserId(userId);
        vo.setWalletBalance(user.getWalletBalance() == null ? BigDecimal.ZERO : user.getWalletBalance());
        vo.setTransactions(new PageVo<>(total, safePage, safeSize, list));
        return vo;
    }
}
