package com.slb.rewards_backend.modules.wallet.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.users.entity.User;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import com.slb.rewards_backend.modules.wallet.entity.WalletTransaction;
import com.slb.rewards_backend.modules.wallet.mapper.WalletTransactionMapper;
import com.slb.rewards_backend.modules.wallet.vo.WalletVo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WalletLedgerServiceTest {

    @Mock
    private WalletTransactionMapper walletTransactionMapper;
    @Mock
    private UserMapper userMapper;

    @InjectMocks
    private WalletLedgerService walletLedgerService;

    @Captor
    private ArgumentCaptor<WalletTransaction> txCaptor;

    @Test
    void creditRebate_firstTime_shouldWriteLedgerThenIncrementBalance() {
        when(walletTransactionMapper.insertIgnore(any())).thenAnswer(inv -> {
            inv.<WalletTransaction>getArgument(0).setId(55L);
            return 1;
        });
        when(userMapper.incrementWalletBalance(2L, new BigDecimal("100.00"))).thenReturn(1);

        Long txId = walletLedgerService.creditRebate(2L, new BigDecimal("100.00"), 9L, "Rebate from level 1 purchase #1");

        assertEquals(55L, txId);
        verify(walletTransactionMapper).insertIgnore(txCaptor.capture());
        WalletTransaction tx = txCaptor.getValue();
        assertEquals("rebate", tx.getType());
        assertEquals("rebate", tx.getRefType());
        assertEquals(9L, tx.getRefId());
        assertEquals("completed", tx.getStatus());
        var order = inOrder(walletTransactionMapper, userMapper);
        order.verify(walletTransactionMapper).insertIgnore(any());
        order.verify(userMapper).incrementWalletBalance(2L, new BigDecimal("100.00"));
    }

    @Test
    void creditRebate_ledgerAlreadyExists_shouldNotIncrementAgain() {
        WalletTransaction existing = new WalletTransaction();
        existing.setId(77L);
        when(walletTransactionMapper.insertIgnore(any())).thenReturn(0);
        when(walletTransactionMapper.selectByRef("rebate", 9L)).thenReturn(Optional.of(existing));

        Long txId = walletLedgerService.creditRebate(2L, new BigDecimal("100.00"), 9L, "dup");

        assertEquals(77L, txId);
        verify(userMapper, never()).incrementWalletBalance(anyLong(), any());
    }

    @Test
    void creditRebate_receiverMissing_shouldThrow404() {
        when(walletTransactionMapper.insertIgnore(any())).thenReturn(1);
        when(userMapper.incrementWalletBalance(anyLong(), any())).thenReturn(0);

        BizException ex = assertThrows(BizException.class,
                () -> walletLedgerService.creditRebate(404L, BigDecimal.ONE, 9L, "x"));
        assertEquals(404, ex.getCode());
    }

    @Test
    void getWallet_shouldClampPageSizeAndReturnBalance() {
        User user = new User();
        user.setId(2L);
        user.setWalletBalance(new BigDecimal("150.00"));
        when(userMapper.selectById(2L)).thenReturn(Optional.of(user));
        when(walletTransactionMapper.countByUserId(2L)).thenReturn(1L);
        WalletTransaction tx = new WalletTransaction();
        tx.setId(1L);
        tx.setUserId(2L);
        tx.setAmount(new BigDecimal("150.00"));
        when(walletTransactionMapper.selectPageByUserId(2L, 0, 100)).thenReturn(List.of(tx));

        WalletVo vo = walletLedgerService.getWallet(2L, 0, 500);

        assertEquals(new BigDecimal("150.00"), vo.getWalletBalance());
        assertEquals(1L, vo.getTransactions().getTotal());
        assertEquals(1, vo.getTransactions().getList().size());
    }

    @Test
    void getWallet_userMissing_shouldThrow404() {
        when(userMapper.selectById(3L)).thenReturn(Optional.empty());

        BizException ex = assertThrows(BizException.class, () -> walletLedgerService.getWallet(3L, 1, 10));
        assertEquals(404, ex.getCode());
        verifyNoInteractions(walletTransactionMapper);
    }
}
