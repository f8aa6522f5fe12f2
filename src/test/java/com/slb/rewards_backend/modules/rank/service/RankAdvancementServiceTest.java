package com.slb.rewards_backend.modules.rank.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.genealogy.service.GenealogyService;
import com.slb.rewards_backend.modules.purchase.mapper.PurchaseMapper;
import com.slb.rewards_backend.modules.rank.config.RankProperties;
import com.slb.rewards_backend.modules.rank.entity.Rank;
import com.slb.rewards_backend.modules.rank.entity.RankRequirement;
import com.slb.rewards_backend.modules.rank.mapper.RankAdvancementMapper;
import com.slb.rewards_backend.modules.rank.mapper.RankMapper;
import com.slb.rewards_backend.modules.rank.vo.RankAdvanceResultVo;
import com.slb.rewards_backend.modules.rank.vo.RankBatchSummaryVo;
import com.slb.rewards_backend.modules.rank.vo.RankEligibilityVo;
import com.slb.rewards_backend.modules.rank.vo.RankVo;
import com.slb.rewards_backend.modules.rank.vo.RequirementCheckVo;
import com.slb.rewards_backend.modules.users.entity.User;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RankAdvancementServiceTest {

    private static final Long BRONZE = 1L;
    private static final Long SILVER = 2L;
    private static final Long GOLD = 3L;

    @Mock
    private UserMapper userMapper;
    @Mock
    private PurchaseMapper purchaseMapper;
    @Mock
    private RankMapper rankMapper;
    @Mock
    private RankAdvancementMapper rankAdvancementMapper;
    @Mock
    private RankService rankService;
    @Mock
    private RankAdvancementTxService txService;
    @Mock
    private GenealogyService genealogyService;

    private RankAdvancementService service;

    @BeforeEach
    void setup() {
        service = new RankAdvancementService(userMapper, purchaseMapper, rankMapper, rankAdvancementMapper,
                rankService, txService, genealogyService, new RankProperties(), false);
    }

    @Test
    void eligibility_unrankedMeetingBronze_shouldBeEligible() {
        givenLadder();
        givenUser(10L, null);
        givenStats(10L, "150", List.of(), "0", 0L);

        RankEligibilityVo vo = service.checkEligibility(10L);

        assertTrue(vo.isEligible());
        assertNull(vo.getCurrentRank());
        assertEquals(BRONZE, vo.getNextRank().getId());
        assertThat(vo.getMissingRequirements()).isEmpty();
        assertThat(vo.getChecks()).extracting(RequirementCheckVo::getRequirement)
                .containsExactly(RankAdvancementService.PERSONAL_SALES, RankAdvancementService.GROUP_SALES,
                        RankAdvancementService.DIRECT_DOWNLINE);
    }

    @Test
    void eligibility_shouldReportEveryMissingRequirement() {
        givenLadder();
        givenUser(10L, BRONZE);
        givenStats(10L, "150", List.of(11L), "350", 1L);
        when(rankMapper.countUsersAtOrAboveLevel(List.of(11L), 1)).thenReturn(0L);

        RankEligibilityVo vo = service.checkEligibility(10L);

        assertFalse(vo.isEligible());
        assertEquals(SILVER, vo.getNextRank().getId());
        assertThat(vo.getMissingRequirements()).containsExactly(
                RankAdvancementService.PERSONAL_SALES,
                RankAdvancementService.GROUP_SALES,
                RankAdvancementService.DIRECT_DOWNLINE,
                RankAdvancementService.QUALIFIED_DOWNLINE);
        assertThat(vo.getGroupSales()).isEqualByComparingTo("500");
    }

    @Test
    void eligibility_groupSalesIncludeSelfAndWholeDownline() {
        givenLadder();
        givenUser(10L, BRONZE);
        givenStats(10L, "200", List.of(11L, 12L), "800", 2L);
        when(rankMapper.countUsersAtOrAboveLevel(List.of(11L, 12L), 1)).thenReturn(1L);

        RankEligibilityVo vo = service.checkEligibility(10L);

        assertTrue(vo.isEligible());
        assertThat(vo.getGroupSales()).isEqualByComparingTo("1000");
        assertEquals(1L, vo.getQualifiedDownlineCount());
    }

    @Test
    void eligibility_nextRankWithoutRequirements_shouldBlock() {
        givenLadder();
        givenUser(10L, SILVER);

        RankEligibilityVo vo = service.checkEligibility(10L);

        assertFalse(vo.isEligible());
        assertThat(vo.getMissingRequirements()).containsExactly(RankAdvancementService.REQUIREMENTS_NOT_CONFIGURED);
        verifyNoInteractions(purchaseMapper, genealogyService);
    }

    @Test
    void eligibility_topRank_shouldHaveNoNextRank() {
        givenLadder();
        givenUser(10L, GOLD);

        RankEligibilityVo vo = service.checkEligibility(10L);

        assertFalse(vo.isEligible());
        assertNull(vo.getNextRank());
    }

    @Test
    void eligibility_unknownUser_shouldReturn404() {
        when(userMapper.selectById(404L)).thenReturn(Optional.empty());

        BizException ex = assertThrows(BizException.class, () -> service.checkEligibility(404L));
        assertEquals(404, ex.getCode());
    }

    @Test
    void eligibility_rankMissingFromCachedLadder_shouldReloadOnce() {
        RankRequirement bronzeReq = requirement(BRONZE, "100", "0", 0, 0, null);
        RankRequirement silverReq = requirement(SILVER, "200", "1000", 2, 1, BRONZE);
        // 第一次读到的是旧缓存，只有 Bronze
        when(rankService.getLadder()).thenReturn(
                List.of(RankVo.of(rank(BRONZE, 1, "Bronze"), bronzeReq)),
                List.of(RankVo.of(rank(BRONZE, 1, "Bronze"), bronzeReq),
                        RankVo.of(rank(SILVER, 2, "Silver"), silverReq),
                        RankVo.of(rank(GOLD, 3, "Gold"), null)));
        givenUser(10L, SILVER);

        RankEligibilityVo vo = service.checkEligibility(10L);

        verify(rankService).evictLadderCache();
        verify(rankService, times(2)).getLadder();
        assertEquals(SILVER, vo.getCurrentRank().getId());
        assertEquals(GOLD, vo.getNextRank().getId());
        assertThat(vo.getMissingRequirements()).containsExactly(RankAdvancementService.REQUIREMENTS_NOT_CONFIGURED);
    }

    @Test
    void advance_rankStillUnknownAfterReload_shouldBlockWithoutCas() {
        givenLadder();
        givenUser(10L, 99L);

        RankAdvanceResultVo result = service.processAdvancement(10L);

        assertFalse(result.isAdvanced());
        assertFalse(result.isConflict());
        assertThat(result.getMessage()).contains("rankId=99");
        verify(rankService).evictLadderCache();
        verifyNoInteractions(txService, genealogyService, purchaseMapper);
    }

    @Test
    void batch_unknownRank_shouldNotCountAsConflict() {
        givenLadder();
        when(userMapper.selectIdsAfter(0L, 500)).thenReturn(List.of(10L));
        when(userMapper.selectIdsAfter(10L, 500)).thenReturn(List.of());
        givenUser(10L, 99L);

        RankBatchSummaryVo summary = service.processAllRankAdvancements();

        assertEquals(1, summary.getProcessed());
        assertEquals(0, summary.getConflicts());
        assertEquals(0, summary.getAdvanced());
        assertEquals(0, summary.getFailed());
    }

    @Test
    void advance_eligible_shouldMoveUpExactlyOneLevel() {
        givenLadder();
        givenUser(10L, null);
        givenStats(10L, "5000", List.of(), "0", 10L);
        when(txService.advance(eq(10L), isNull(), eq(BRONZE), any())).thenReturn(true);

        RankAdvanceResultVo result = service.processAdvancement(10L);

        assertTrue(result.isAdvanced());
        assertFalse(result.isConflict());
        assertEquals(BRONZE, result.getNewRank().getId());
    }

    @Test
    void advance_casLost_shouldReportConflictWithoutError() {
        givenLadder();
        givenUser(10L, null);
        givenStats(10L, "150", List.of(), "0", 0L);
        when(txService.advance(eq(10L), isNull(), eq(BRONZE), any())).thenReturn(false);

        RankAdvanceResultVo result = service.processAdvancement(10L);

        assertFalse(result.isAdvanced());
        assertTrue(result.isConflict());
        assertNull(result.getNewRank());
    }

    @Test
    void advance_notEligible_shouldNotTouchRank() {
        givenLadder();
        givenUser(10L, null);
        givenStats(10L, "10", List.of(), "0", 0L);

        RankAdvanceResultVo result = service.processAdvancement(10L);

        assertFalse(result.isAdvanced());
        assertFalse(result.isConflict());
        verifyNoInteractions(txService);
    }

    @Test
    void batch_shouldIsolateFailuresAndCountConflicts() {
        givenLadder();
        when(userMapper.selectIdsAfter(0L, 500)).thenReturn(List.of(10L, 20L, 30L));
        when(userMapper.selectIdsAfter(30L, 500)).thenReturn(List.of());
        givenUser(10L, null);
        givenStats(10L, "150", List.of(), "0", 0L);
        when(userMapper.selectById(20L)).thenReturn(Optional.empty());
        givenUser(30L, null);
        givenStats(30L, "150", List.of(), "0", 0L);
        when(txService.advance(eq(10L), isNull(), eq(BRONZE), any())).thenReturn(true);
        when(txService.advance(eq(30L), isNull(), eq(BRONZE), any())).thenReturn(false);

        RankBatchSummaryVo summary = service.processAllRankAdvancements();

        assertEquals(3, summary.getProcessed());
        assertEquals(1, summary.getAdvanced());
        assertEquals(1, summary.getFailed());
        assertEquals(1, summary.getConflicts());
        assertEquals(20L, summary.getFailedUsers().get(0).getUserId());
    }

    private void givenLadder() {
        RankRequirement bronzeReq = requirement(BRONZE, "100", "0", 0, 0, null);
        RankRequirement silverReq = requirement(SILVER, "200", "1000", 2, 1, BRONZE);
        when(rankService.getLadder()).thenReturn(List.of(
                RankVo.of(rank(BRONZE, 1, "Bronze"), bronzeReq),
                RankVo.of(rank(SILVER, 2, "Silver"), silverReq),
                RankVo.of(rank(GOLD, 3, "Gold"), null)));
    }

    private void givenUser(Long id, Long rankId) {
        User user = new User();
        user.setId(id);
        user.setRankId(rankId);
        when(userMapper.selectById(id)).thenReturn(Optional.of(user));
    }

    private void givenStats(Long userId, String personal, List<Long> downline, String downlineSales, long direct) {
        when(genealogyService.countDirectDownline(userId)).thenReturn(direct);
        when(genealogyService.getEntireDownlineIds(userId)).thenReturn(downline);
        when(purchaseMapper.sumCompletedAmountByUserIds(List.of(userId))).thenReturn(new BigDecimal(personal));
        if (!downline.isEmpty()) {
            when(purchaseMapper.sumCompletedAmountByUserIds(downline)).thenReturn(new BigDecimal(downlineSales));
        }
    }

    private static Rank rank(Long id, int level, String name) {
        Rank rank = new Rank();
        rank.setId(id);
        rank.setLevel(level);
        rank.setName(name);
        return rank;
    }

    private static RankRequirement requirement(Long rankId, String personal, String group, int direct, int qualified, Long qualifiedRankId) {
        RankRequirement req = new RankRequirement();
        req.setRankId(rankId);
        req.setRequiredPersonalSales(new BigDecimal(personal));
        req.setRequiredGroupSales(new BigDecimal(group));
        req.setRequiredDirectDownline(direct);
        req.setRequiredQualifiedDownline(qualified);
        req.setQualifiedRankId(qualifiedRankId);
        return req;
    }
}
