package com.slb.rewards_backend.modules.rank.service;

import com.slb.rewards_backend.modules.rank.entity.RankAdvancement;
import com.slb.rewards_backend.modules.rank.mapper.RankAdvancementMapper;
import com.slb.rewards_backend.modules.rank.vo.RankEligibilityVo;
import com.slb.rewards_backend.modules.users.mapper.UserMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RankAdvancementTxServiceTest {

    @Mock
    private UserMapper userMapper;
    @Mock
    private RankAdvancementMapper rankAdvancementMapper;

    @InjectMocks
    private RankAdvancementTxService txService;

    @Captor
    private ArgumentCaptor<RankAdvancement> advancementCaptor;

    @Test
    void advance_casWon_shouldAppendAuditRow() {
        when(userMapper.updateRankIfCurrent(10L, 1L, 2L)).thenReturn(1);
        RankEligibilityVo snapshot = new RankEligibilityVo();
        snapshot.setPersonalSales(new BigDecimal("200"));
        snapshot.setGroupSales(new BigDecimal("1200"));
        snapshot.setDirectDownlineCount(3);
        snapshot.setQualifiedDownlineCount(1);

        assertTrue(txService.advance(10L, 1L, 2L, snapshot));

        verify(rankAdvancementMapper).insert(advancementCaptor.capture());
        RankAdvancement row = advancementCaptor.getValue();
        assertEquals(1L, row.getPreviousRankId());
        assertEquals(2L, row.getNewRankId());
        assertEquals(new BigDecimal("1200"), row.getGroupSales());
        assertEquals(3L, row.getDirectDownlineCount());
    }

    @Test
    void advance_casLost_shouldWriteNothing() {
        when(userMapper.updateRankIfCurrent(10L, null, 1L)).thenReturn(0);

        assertFalse(txService.advance(10L, null, 1L, new RankEligibilityVo()));

        verifyNoInteractions(rankAdvancementMapper);
    }
}
