package com.slb.rewards_backend.modules.binary.service;

import com.slb.rewards_backend.common.exception.BizException;
import com.slb.rewards_backend.modules.binary.config.BinaryPlanProperties;
import com.slb.rewards_backend.modules.binary.entity.MonthlyCutoff;
import com.slb.rewards_backend.modules.binary.entity.MonthlyPerformance;
import com.slb.rewards_backend.modules.binary.mapper.MonthlyCutoffMapper;
import com.slb.rewards_backend.modules.binary.repository.BinaryVolumeRepository;
import com.slb.rewards_backend.modules.binary.repository.PlacementNode;
import com.slb.rewards_backend.modules.binary.vo.MonthlySnapshotSummaryVo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonthlySnapshotServiceTest {

    @Mock
    private BinaryVolumeRepository volumeRepository;
    @Mock
    private MonthlyCutoffMapper cutoffMapper;

    @Captor
    private ArgumentCaptor<List<MonthlyPerformance>> rowsCaptor;
    @Captor
    private ArgumentCaptor<MonthlyCutoff> cutoffCaptor;

    private BinaryPlanProperties plan;
    private MonthlySnapshotService service;

    @BeforeEach
    void setup() {
        plan = new BinaryPlanProperties();
        plan.setWriteBatchSize(2);
        BinaryPlanProperties.GroupVolumeTier tier = new BinaryPlanProperties.GroupVolumeTier();
        tier.setMinWeakerLegPv(new BigDecimal("100"));
        tier.setPairPv(new BigDecimal("100"));
        tier.setPairBonus(new BigDecimal("500"));
        plan.getGroupVolumeTiers().add(tier);
        service = new MonthlySnapshotService(volumeRepository, cutoffMapper, new BinaryCommissionCalculator(), plan, true);
    }

    @Test
    void snapshot_shouldQueryCalendarMonthAndWriteRowsInBatches() {
        givenTree();

        MonthlySnapshotSummaryVo summary = service.runMonthlySnapshot(2026, 2, true);

        verify(volumeRepository).sumPersonalPvBetween(
                LocalDateTime.of(2026, 2, 1, 0, 0), LocalDateTime.of(2026, 3, 1, 0, 0));
        verify(volumeRepository, times(2)).upsertPerformance(rowsCaptor.capture());
        assertThat(rowsCaptor.getAllValues()).extracting(List::size).containsExactly(2, 1);
        assertEquals(3, summary.getProcessed());
        assertEquals(0, summary.getSkipped());
        assertEquals(MonthlyCutoff.STATUS_COMPLETED, summary.getStatus());
        assertThat(summary.getRows()).hasSize(3);
        assertThat(summary.getRows().get(0).getGroupVolumeBonus()).isEqualByComparingTo("500");

        verify(cutoffMapper).upsertProcessing(any());
        verify(cutoffMapper).updateFinished(cutoffCaptor.capture());
        assertEquals(MonthlyCutoff.STATUS_COMPLETED, cutoffCaptor.getValue().getStatus());
        assertEquals(3, cutoffCaptor.getValue().getProcessedUsers());
    }

    @Test
    void snapshot_rerun_shouldWriteIdenticalRows() {
        givenTree();

        service.runMonthlySnapshot(2026, 2, false);
        service.runMonthlySnapshot(2026, 2, false);

        verify(volumeRepository, times(4)).upsertPerformance(rowsCaptor.capture());
        List<List<MonthlyPerformance>> batches = rowsCaptor.getAllValues();
        List<MonthlyPerformance> first = new ArrayList<>(batches.get(0));
        first.addAll(batches.get(1));
        List<MonthlyPerformance> second = new ArrayList<>(batches.get(2));
        second.addAll(batches.get(3));
        assertThat(second).isEqualTo(first);
    }

    @Test
    void snapshot_withoutIncludeRows_shouldNotReturnRows() {
        givenTree();

        assertThat(service.runMonthlySnapshot(2026, 2, false).getRows()).isNull();
    }

    @Test
    void snapshot_malformedUser_shouldBeReportedAsSkipped() {
        when(volumeRepository.loadPlacementNodes()).thenReturn(List.of(
                new PlacementNode(1L, null, 1L, null, null),
                new PlacementNode(2L, null, null, null, null)));
        when(volumeRepository.sumPersonalPvBetween(any(), any())).thenReturn(Map.of());

        MonthlySnapshotSummaryVo summary = service.runMonthlySnapshot(2026, 2, false);

        assertEquals(1, summary.getProcessed());
        assertEquals(1, summary.getSkipped());
        assertThat(summary.getSkippedUsers()).extracting(MonthlySnapshotSummaryVo.UserIssue::getUserId).containsExactly(1L);
        assertEquals(MonthlyCutoff.STATUS_COMPLETED, summary.getStatus());
    }

    @Test
    void snapshot_batchWriteFails_shouldCountUsersAsFailedAndContinue() {
        givenTree();
        doThrow(new QueryTimeoutException("timeout")).doNothing().when(volumeRepository).upsertPerformance(anyList());

        MonthlySnapshotSummaryVo summary = service.runMonthlySnapshot(2026, 2, false);

        assertEquals(1, summary.getProcessed());
        assertEquals(2, summary.getFailed());
        assertEquals(MonthlyCutoff.STATUS_COMPLETED, summary.getStatus());
    }

    @Test
    void snapshot_loadFails_shouldRecordFailedCutoffAndRethrow() {
        when(volumeRepository.loadPlacementNodes()).thenThrow(new QueryTimeoutException("timeout"));

        assertThrows(QueryTimeoutException.class, () -> service.runMonthlySnapshot(2026, 2, false));

        verify(cutoffMapper).updateFinished(cutoffCaptor.capture());
        assertEquals(MonthlyCutoff.STATUS_FAILED, cutoffCaptor.getValue().getStatus());
        assertThat(cutoffCaptor.getValue().getNotes()).contains("timeout");
    }

    @Test
    void snapshot_invalidMonth_shouldReturn400() {
        BizException ex = assertThrows(BizException.class, () -> service.runMonthlySnapshot(2026, 13, false));
        assertEquals(400, ex.getCode());
        verifyNoInteractions(volumeRepository, cutoffMapper);
    }

    @Test
    void job_disabled_shouldDoNothing() {
        MonthlySnapshotService disabled = new MonthlySnapshotService(volumeRepository, cutoffMapper,
                new BinaryCommissionCalculator(), plan, false);

        disabled.monthlySnapshotJob();

        verifyNoInteractions(volumeRepository, cutoffMapper);
    }

    private void givenTree() {
        when(volumeRepository.loadPlacementNodes()).thenReturn(List.of(
                new PlacementNode(1L, null, 2L, 3L, null),
                new PlacementNode(2L, 1L, null, null, null),
                new PlacementNode(3L, 1L, null, null, null)));
        when(volumeRepository.sumPersonalPvBetween(any(), any())).thenReturn(Map.of(
                2L, new BigDecimal("300"),
                3L, new BigDecimal("100")));
    }
}
