package com.slb.rewards_backend.modules.rebate.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.genealogy.service.GenealogyService;
import com.slb.rewards_backend.modules.purchase.entity.Purchase;
import com.slb.rewards_backend.modules.purchase.mapper.PurchaseMapper;
import com.slb.rewards_backend.modules.rebate.config.RebateProperties;
import com.slb.rewards_backend.modules.rebate.entity.Rebate;
import com.slb.rewards_backend.modules.rebate.entity.RebateConfig;
import com.slb.rewards_backend.modules.rebate.mapper.RebateConfigMapper;
import com.slb.rewards_backend.modules.rebate.mapper.RebateMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RebateCalculationServiceTest {

    private static final Long PRODUCT_ID = 7L;

    @Mock
    private PurchaseMapper purchaseMapper;
    @Mock
    private RebateConfigMapper rebateConfigMapper;
    @Mock
    private RebateMapper rebateMapper;
    @Mock
    private GenealogyService genealogyService;

    @Captor
    private ArgumentCaptor<Rebate> rebateCaptor;

    private RebateCalculationService service;

    @BeforeEach
    void setup() {
        service = new RebateCalculationService(purchaseMapper, rebateConfigMapper, rebateMapper,
                genealogyService, new RebateProperties());
    }

    @Test
    void compute_twoLevelPercentage_shouldCreateOneRowPerConfiguredLevel() {
        // 链路 C -> B -> A，C 下单 1000，level1 10%，level2 5%
        when(purchaseMapper.selectById(100L)).thenReturn(Optional.of(purchase(100L, 3L, "1000.00", Purchase.STATUS_COMPLETED)));
        when(rebateConfigMapper.selectByProductId(PRODUCT_ID)).thenReturn(List.of(
                percentage(1, "10"), percentage(2, "5")));
        when(genealogyService.getUpline(3L, 2)).thenReturn(List.of(2L, 1L));
        when(rebateMapper.insertIgnore(any())).thenReturn(1);

        List<Rebate> created = service.computeRebatesForPurchase(100L);

        assertEquals(2, created.size());
        verify(rebateMapper, times(2)).insertIgnore(rebateCaptor.capture());
        List<Rebate> rows = rebateCaptor.getAllValues();
        assertEquals(2L, rows.get(0).getReceiverId());
        assertEquals(1, rows.get(0).getLevel());
        assertEquals(new BigDecimal("100.00"), rows.get(0).getAmount());
        assertEquals(1L, rows.get(1).getReceiverId());
        assertEquals(new BigDecimal("50.00"), rows.get(1).getAmount());
        assertTrue(rows.stream().noneMatch(r -> r.getReceiverId().equals(3L)), "buyer never receives a rebate");
        assertTrue(rows.stream().allMatch(r -> "pending".equals(r.getStatus())));
    }

    @Test
    void compute_uplineShorterThanConfig_shouldCreateFewerRows() {
        when(purchaseMapper.selectById(100L)).thenReturn(Optional.of(purchase(100L, 2L, "200.00", Purchase.STATUS_COMPLETED)));
        when(rebateConfigMapper.selectByProductId(PRODUCT_ID)).thenReturn(List.of(
                percentage(1, "10"), percentage(2, "5"), percentage(3, "1")));
        when(genealogyService.getUpline(2L, 3)).thenReturn(List.of(1L));
        when(rebateMapper.insertIgnore(any())).thenReturn(1);

        List<Rebate> created = service.computeRebatesForPurchase(100L);

        assertEquals(1, created.size());
        assertEquals(new BigDecimal("20.00"), created.get(0).getAmount());
    }

    @Test
    void compute_levelWithoutConfig_shouldBeSkipped() {
        when(purchaseMapper.selectById(100L)).thenReturn(Optional.of(purchase(100L, 4L, "1000.00", Purchase.STATUS_COMPLETED)));
        when(rebateConfigMapper.selectByProductId(PRODUCT_ID)).thenReturn(List.of(
                percentage(1, "10"), percentage(3, "2")));
        when(genealogyService.getUpline(4L, 3)).thenReturn(List.of(3L, 2L, 1L));
        when(rebateMapper.insertIgnore(any())).thenReturn(1);

        List<Rebate> created = service.computeRebatesForPurchase(100L);

        assertEquals(List.of(1, 3), created.stream().map(Rebate::getLevel).toList());
        assertEquals(1L, created.get(1).getReceiverId());
    }

    @Test
    void compute_reinvoked_shouldNotReturnRowsThatAlreadyExist() {
        when(purchaseMapper.selectById(100L)).thenReturn(Optional.of(purchase(100L, 3L, "1000.00", Purchase.STATUS_COMPLETED)));
        when(rebateConfigMapper.selectByProductId(PRODUCT_ID)).thenReturn(List.of(percentage(1, "10")));
        when(genealogyService.getUpline(3L, 1)).thenReturn(List.of(2L));
        // 唯一键冲突：INSERT IGNORE 影响 0 行
        when(rebateMapper.insertIgnore(any())).thenReturn(0);

        assertTrue(service.computeRebatesForPurchase(100L).isEmpty());
    }

    @Test
    void compute_fixedReward_shouldIgnorePercentage() {
        RebateConfig fixed = new RebateConfig();
        fixed.setProductId(PRODUCT_ID);
        fixed.setLevel(1);
        fixed.setRewardType("fixed");
        fixed.setFixedAmount(new BigDecimal("25"));
        when(purchaseMapper.selectById(100L)).thenReturn(Optional.of(purchase(100L, 3L, "1000.00", Purchase.STATUS_COMPLETED)));
        when(rebateConfigMapper.selectByProductId(PRODUCT_ID)).thenReturn(List.of(fixed));
        when(genealogyService.getUpline(3L, 1)).thenReturn(List.of(2L));
        when(rebateMapper.insertIgnore(any())).thenReturn(1);

        List<Rebate> created = service.computeRebatesForPurchase(100L);

        assertEquals(new BigDecimal("25.00"), created.get(0).getAmount());
        assertNull(created.get(0).getPercentage());
    }

    @Test
    void compute_purchaseNotCompleted_shouldReturn409() {
        when(purchaseMapper.selectById(100L)).thenReturn(Optional.of(purchase(100L, 3L, "1000.00", Purchase.STATUS_PENDING)));

        BizException ex = assertThrows(BizException.class, () -> service.computeRebatesForPurchase(100L));
        assertEquals(409, ex.getCode());
        verifyNoInteractions(rebateMapper, genealogyService);
    }

    @Test
    void compute_purchaseMissing_shouldReturn404() {
        when(purchaseMapper.selectById(100L)).thenReturn(Optional.empty());

        BizException ex = assertThrows(BizException.class, () -> service.computeRebatesForPurchase(100L));
        assertEquals(404, ex.getCode());
    }

    @Test
    void computeAmount_shouldRoundHalfUpOncePerRow() {
        assertEquals(new BigDecimal("0.13"), RebateCalculationService.computeAmount(new BigDecimal("2.50"), percentage(1, "5")));
        assertEquals(new BigDecimal("33.33"), RebateCalculationService.computeAmount(new BigDecimal("333.33"), percentage(1, "10")));
        assertEquals(new BigDecimal("0.00"), RebateCalculationService.computeAmount(new BigDecimal("100"), percentage(1, "0")));
    }

    private static Purchase purchase(Long id, Long userId, String amount, String status) {
        Purchase p = new Purchase();
        p.setId(id);
        p.setUserId(userId);
        p.setProductId(PRODUCT_ID);
        p.setTotalAmount(new BigDecimal(amount));
        p.setStatus(status);
        return p;
    }

    private static RebateConfig percentage(int level, String pct) {
        RebateConfig c = new RebateConfig();
        c.setProductId(PRODUCT_ID);
        c.setLevel(level);
        c.setRewardType("percentage");
        c.setPercentage(new BigDecimal(pct));
        return c;
    }
}
