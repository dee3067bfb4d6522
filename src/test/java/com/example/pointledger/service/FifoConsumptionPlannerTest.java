package com.example.pointledger.service;

import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchSource;
import com.example.pointledger.entity.PointBatchStatus;
import com.example.pointledger.exception.InsufficientBalanceException;
import com.example.pointledger.service.impl.FifoConsumptionPlanner;
import com.example.pointledger.service.model.ConsumptionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * FifoConsumptionPlanner 單元測試
 *
 * 測試範圍：
 * - FIFO 排序（expiresAt、永不過期排最後、issuedAt、id）
 * - 已到期 / 非 ACTIVE 批次不可消費
 * - 點數不足時拋出異常
 */
@DisplayName("FifoConsumptionPlanner Unit Tests")
class FifoConsumptionPlannerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 10, 12, 0);

    @Test
    @DisplayName("plan - Soonest expiring batch first - Takes 5 from B1 then 2 from B2")
    void plan_WithTwoExpiringBatches_ConsumesSoonestExpiringFirst() {
        // Given
        PointBatch b1 = batch(1L, 5, NOW.minusDays(2), NOW.plusDays(1));
        PointBatch b2 = batch(2L, 10, NOW.minusDays(1), NOW.plusDays(2));

        // When
        List<ConsumptionRecord> plan = FifoConsumptionPlanner.plan("alice", List.of(b2, b1), 7, NOW);

        // Then
        assertThat(plan).extracting(ConsumptionRecord::getBatchId, ConsumptionRecord::getAmountTaken)
            .containsExactly(tuple(1L, 5L), tuple(2L, 2L));
    }

    @Test
    @DisplayName("plan - Batch without expiry - Consumed after expiring batches")
    void plan_WithNeverExpiringBatch_ConsumedLast() {
        // Given
        PointBatch forever = batch(1L, 100, NOW.minusDays(30), null);
        PointBatch expiring = batch(2L, 10, NOW.minusDays(1), NOW.plusDays(60));

        // When
        List<ConsumptionRecord> plan = FifoConsumptionPlanner.plan("alice", List.of(forever, expiring), 15, NOW);

        // Then
        assertThat(plan).extracting(ConsumptionRecord::getBatchId).containsExactly(2L, 1L);
        assertThat(plan.get(1).getSourceExpiresAt()).isNull();
    }

    @Test
    @DisplayName("plan - Equal expiry - Ordered by issuedAt then id")
    void plan_WithEqualExpiry_OrdersByIssuedAtThenId() {
        // Given
        LocalDateTime expiry = NOW.plusDays(5);
        PointBatch laterIssued = batch(1L, 3, NOW.minusHours(1), expiry);
        PointBatch sameIssuedHighId = batch(3L, 3, NOW.minusHours(2), expiry);
        PointBatch sameIssuedLowId = batch(2L, 3, NOW.minusHours(2), expiry);

        // When
        List<ConsumptionRecord> plan = FifoConsumptionPlanner.plan(
            "alice", List.of(laterIssued, sameIssuedHighId, sameIssuedLowId), 9, NOW);

        // Then
        assertThat(plan).extracting(ConsumptionRecord::getBatchId).containsExactly(2L, 3L, 1L);
    }

    @Test
    @DisplayName("plan - Batch expiring exactly now - Not eligible")
    void plan_WithBatchExpiringNow_SkipsIt() {
        // Given
        PointBatch expiredNow = batch(1L, 50, NOW.minusDays(10), NOW);
        PointBatch valid = batch(2L, 20, NOW.minusDays(1), NOW.plusSeconds(1));

        // When
        List<ConsumptionRecord> plan = FifoConsumptionPlanner.plan("alice", List.of(expiredNow, valid), 20, NOW);

        // Then
        assertThat(plan).extracting(ConsumptionRecord::getBatchId).containsExactly(2L);
    }

    @Test
    @DisplayName("plan - Only expired points cover the amount - Throws InsufficientBalanceException")
    void plan_WithOnlyExpiredPointsCoveringAmount_ThrowsInsufficientBalance() {
        // Given
        PointBatch expired = batch(1L, 50, NOW.minusDays(10), NOW.minusDays(1));
        PointBatch valid = batch(2L, 20, NOW.minusDays(1), null);

        // When & Then
        assertThatThrownBy(() -> FifoConsumptionPlanner.plan("alice", List.of(expired, valid), 30, NOW))
            .isInstanceOf(InsufficientBalanceException.class)
            .satisfies(e -> {
                InsufficientBalanceException ex = (InsufficientBalanceException) e;
                assertThat(ex.getUserId()).isEqualTo("alice");
                assertThat(ex.getAvailable()).isEqualTo(20L);
                assertThat(ex.getRequired()).isEqualTo(30L);
            });
    }

    @Test
    @DisplayName("plan - Non ACTIVE batches - Ignored")
    void plan_WithTerminalBatches_IgnoresThem() {
        // Given
        PointBatch consumed = batch(1L, 10, NOW.minusDays(3), NOW.plusDays(1));
        consumed.setStatus(PointBatchStatus.CONSUMED);
        PointBatch active = batch(2L, 10, NOW.minusDays(2), NOW.plusDays(2));

        // When
        List<ConsumptionRecord> plan = FifoConsumptionPlanner.plan("alice", List.of(consumed, active), 10, NOW);

        // Then
        assertThat(plan).extracting(ConsumptionRecord::getBatchId).containsExactly(2L);
    }

    @Test
    @DisplayName("plan - Exact balance - Drains every batch")
    void plan_WithExactBalance_DrainsEveryBatch() {
        // Given
        PointBatch b1 = batch(1L, 5, NOW.minusDays(2), NOW.plusDays(1));
        PointBatch b2 = batch(2L, 10, NOW.minusDays(1), NOW.plusDays(2));

        // When
        List<ConsumptionRecord> plan = FifoConsumptionPlanner.plan("alice", List.of(b1, b2), 15, NOW);

        // Then
        assertThat(plan).extracting(ConsumptionRecord::getAmountTaken).containsExactly(5L, 10L);
        // 規劃不修改批次
        assertThat(b1.getRemainingAmount()).isEqualTo(5L);
    }

    private PointBatch batch(Long id, long remaining, LocalDateTime issuedAt, LocalDateTime expiresAt) {
        return PointBatch.builder()
            .id(id)
            .userId("alice")
            .originalAmount(remaining)
            .remainingAmount(remaining)
            .forfeitedAmount(0L)
            .sourceType(PointBatchSource.ADMIN_GRANT)
            .status(PointBatchStatus.ACTIVE)
            .issuedAt(issuedAt)
            .expiresAt(expiresAt)
            .build();
    }
}
