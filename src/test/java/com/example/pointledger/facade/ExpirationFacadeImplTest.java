package com.example.pointledger.facade;

import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchStatus;
import com.example.pointledger.exception.BatchAlreadyTerminalException;
import com.example.pointledger.facade.dto.SweepResult;
import com.example.pointledger.facade.impl.ExpirationFacadeImpl;
import com.example.pointledger.service.PointBatchService;
import com.example.pointledger.service.TransferRequestService;
import com.example.pointledger.service.model.StaleExpiryResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * ExpirationFacadeImpl 單元測試
 *
 * 測試策略：
 * 1. Mock PointBatchService 與 TransferRequestService
 * 2. 驗證分頁迴圈、失敗略過與統計結果
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ExpirationFacadeImpl Unit Tests")
class ExpirationFacadeImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 10, 12, 0);

    @Mock
    private PointBatchService pointBatchService;

    @Mock
    private TransferRequestService transferRequestService;

    @InjectMocks
    private ExpirationFacadeImpl expirationFacade;

    @Test
    @DisplayName("runExpirationSweep - Across several pages - Expires all batches and stale requests")
    void runExpirationSweep_AcrossSeveralPages_ExpiresEverything() {
        // Given
        when(pointBatchService.findExpiredBatches(NOW, 2))
                .thenReturn(List.of(batch(1L), batch(2L)))
                .thenReturn(List.of(batch(3L)));
        when(pointBatchService.markExpired(1L)).thenReturn(expired(1L, 10));
        when(pointBatchService.markExpired(2L)).thenReturn(expired(2L, 20));
        when(pointBatchService.markExpired(3L)).thenReturn(expired(3L, 5));
        when(transferRequestService.expireStale(NOW, 2)).thenReturn(stale(2, 2), stale(1, 1));

        // When
        SweepResult result = expirationFacade.runExpirationSweep(NOW, 2);

        // Then
        assertThat(result.getExpiredBatches()).isEqualTo(3);
        assertThat(result.getForfeitedPoints()).isEqualTo(35L);
        assertThat(result.getExpiredRequests()).isEqualTo(3);
        verify(pointBatchService, times(2)).findExpiredBatches(NOW, 2);
        verify(transferRequestService, times(2)).expireStale(NOW, 2);
    }

    @Test
    @DisplayName("runExpirationSweep - Request rejected during sweep - Keeps paging through full pages")
    void runExpirationSweep_RequestRejectedDuringSweep_KeepsPaging() {
        // Given: 第一頁 3 筆候選中 1 筆已被拒絕（CAS 落敗），後面仍有逾期請求
        when(pointBatchService.findExpiredBatches(NOW, 3)).thenReturn(List.of());
        when(transferRequestService.expireStale(NOW, 3))
                .thenReturn(stale(3, 2), stale(3, 3), stale(1, 1));

        // When
        SweepResult result = expirationFacade.runExpirationSweep(NOW, 3);

        // Then
        assertThat(result.getExpiredRequests()).isEqualTo(6);
        verify(transferRequestService, times(3)).expireStale(NOW, 3);
    }

    @Test
    @DisplayName("runExpirationSweep - With nothing to expire - Returns empty result")
    void runExpirationSweep_WithNothingToExpire_ReturnsEmptyResult() {
        // Given
        when(pointBatchService.findExpiredBatches(NOW, 100)).thenReturn(List.of());
        when(transferRequestService.expireStale(NOW, 100)).thenReturn(stale(0, 0));

        // When
        SweepResult result = expirationFacade.runExpirationSweep(NOW, 100);

        // Then
        assertThat(result.getExpiredBatches()).isZero();
        assertThat(result.getForfeitedPoints()).isZero();
        assertThat(result.getExpiredRequests()).isZero();
        verify(pointBatchService, never()).markExpired(anyLong());
    }

    @Test
    @DisplayName("runExpirationSweep - One batch fails - Skips it and keeps sweeping the rest")
    void runExpirationSweep_OneBatchFails_SkipsItAndContinues() {
        // Given
        when(pointBatchService.findExpiredBatches(NOW, 2)).thenReturn(List.of(batch(1L), batch(2L)));
        // 失敗的批次 1 仍為 ACTIVE，下一頁多取一筆
        when(pointBatchService.findExpiredBatches(NOW, 3)).thenReturn(List.of(batch(1L), batch(3L)));
        when(pointBatchService.markExpired(1L)).thenThrow(new QueryTimeoutException("lock wait timeout"));
        when(pointBatchService.markExpired(2L)).thenReturn(expired(2L, 20));
        when(pointBatchService.markExpired(3L)).thenReturn(expired(3L, 5));
        when(transferRequestService.expireStale(NOW, 2)).thenReturn(stale(0, 0));

        // When
        SweepResult result = expirationFacade.runExpirationSweep(NOW, 2);

        // Then
        assertThat(result.getExpiredBatches()).isEqualTo(2);
        assertThat(result.getForfeitedPoints()).isEqualTo(25L);
        verify(pointBatchService, times(1)).markExpired(1L);
    }

    @Test
    @DisplayName("runExpirationSweep - Batch consumed concurrently - Not counted and not retried")
    void runExpirationSweep_BatchConsumedConcurrently_NotCounted() {
        // Given
        when(pointBatchService.findExpiredBatches(NOW, 10)).thenReturn(List.of(batch(1L)));
        when(pointBatchService.markExpired(1L))
                .thenThrow(new BatchAlreadyTerminalException(1L, PointBatchStatus.CONSUMED));
        when(transferRequestService.expireStale(NOW, 10)).thenReturn(stale(0, 0));

        // When
        SweepResult result = expirationFacade.runExpirationSweep(NOW, 10);

        // Then
        assertThat(result.getExpiredBatches()).isZero();
        verify(pointBatchService, times(1)).findExpiredBatches(any(), anyInt());
    }

    @Test
    @DisplayName("runExpirationSweep - With non-positive page limit - Throws IllegalArgumentException")
    void runExpirationSweep_WithNonPositivePageLimit_Throws() {
        assertThatThrownBy(() -> expirationFacade.runExpirationSweep(NOW, 0))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(pointBatchService, transferRequestService);
    }

    private StaleExpiryResult stale(int candidates, int expired) {
        return new StaleExpiryResult(candidates, expired);
    }

    private PointBatch batch(Long id) {
        return PointBatch.builder()
                .id(id)
                .userId("user_" + id)
                .remainingAmount(10L)
                .status(PointBatchStatus.ACTIVE)
                .expiresAt(NOW.minusMinutes(1))
                .build();
    }

    private PointBatch expired(Long id, long forfeited) {
        return PointBatch.builder()
                .id(id)
                .userId("user_" + id)
                .remainingAmount(0L)
                .forfeitedAmount(forfeited)
                .status(PointBatchStatus.EXPIRED)
                .build();
    }
}
