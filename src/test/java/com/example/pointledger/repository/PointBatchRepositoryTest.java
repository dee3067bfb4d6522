package com.example.pointledger.repository;

import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchSource;
import com.example.pointledger.entity.PointBatchStatus;
import com.example.pointledger.mq.producer.LedgerEventProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * PointBatchRepository 整合測試
 *
 * 測試策略：
 * 1. 使用 @SpringBootTest + Testcontainers 進行整合測試
 * 2. 使用真實的 MySQL 資料庫容器
 * 3. 使用 @Transactional 自動回滾測試資料
 *
 * 測試範圍：
 * - 悲觀鎖查詢 (findByUserIdAndStatusForUpdate)
 * - 過期清掃查詢 (findExpiredBatches)
 * - 即將過期查詢 (findUpcomingExpirations)
 * - 餘額彙總 (sumSpendableAmount)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
@Transactional
@DisplayName("PointBatchRepository Tests")
class PointBatchRepositoryTest {

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @MockitoBean
    private LedgerEventProducer ledgerEventProducer;

    @Autowired
    private PointBatchRepository pointBatchRepository;

    private LocalDateTime now;

    @BeforeEach
    void setUp() {
        now = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
    }

    @Test
    @DisplayName("save - With valid batch - Persists and generates ID")
    void save_WithValidBatch_PersistsAndGeneratesId() {
        // When
        PointBatch saved = pointBatchRepository.save(batch("user_001", 100, now.plusDays(30)));

        // Then
        assertThat(saved.getId()).isNotNull();
        assertThat(saved.getVersion()).isNotNull();
        assertThat(pointBatchRepository.findById(saved.getId()))
                .get()
                .extracting(PointBatch::getRemainingAmount, PointBatch::getStatus)
                .containsExactly(100L, PointBatchStatus.ACTIVE);
    }

    @Test
    @DisplayName("findByUserIdAndStatusForUpdate - Returns only ACTIVE batches of the user ordered by id")
    void findByUserIdAndStatusForUpdate_ReturnsActiveBatchesOrderedById() {
        // Given
        PointBatch b1 = pointBatchRepository.save(batch("user_001", 10, now.plusDays(5)));
        PointBatch b2 = pointBatchRepository.save(batch("user_001", 20, null));
        PointBatch consumed = batch("user_001", 0, now.plusDays(5));
        consumed.setStatus(PointBatchStatus.CONSUMED);
        pointBatchRepository.save(consumed);
        pointBatchRepository.save(batch("user_002", 30, null));

        // When
        List<PointBatch> locked = pointBatchRepository.findByUserIdAndStatusForUpdate("user_001", PointBatchStatus.ACTIVE);

        // Then
        assertThat(locked).extracting(PointBatch::getId).containsExactly(b1.getId(), b2.getId());
    }

    @Test
    @DisplayName("findExpiredBatches - Returns past-due batches with remaining points, oldest expiry first")
    void findExpiredBatches_ReturnsPastDueBatchesOldestFirst() {
        // Given
        PointBatch older = pointBatchRepository.save(batch("user_001", 10, now.minusDays(2)));
        PointBatch newer = pointBatchRepository.save(batch("user_002", 10, now.minusHours(1)));
        pointBatchRepository.save(batch("user_001", 10, now));              // 恰好到期：不在 before 之前
        pointBatchRepository.save(batch("user_001", 10, null));             // 永不過期
        pointBatchRepository.save(batch("user_001", 10, now.plusDays(1)));  // 尚未到期

        // When
        List<PointBatch> expired = pointBatchRepository.findExpiredBatches(
                PointBatchStatus.ACTIVE, now, PageRequest.of(0, 10));

        // Then
        assertThat(expired).extracting(PointBatch::getId).containsExactly(older.getId(), newer.getId());
    }

    @Test
    @DisplayName("findExpiredBatches - Honours page limit")
    void findExpiredBatches_HonoursPageLimit() {
        // Given
        for (int i = 0; i < 5; i++) {
            pointBatchRepository.save(batch("user_001", 10, now.minusDays(5 - i)));
        }

        // When
        List<PointBatch> page = pointBatchRepository.findExpiredBatches(
                PointBatchStatus.ACTIVE, now, PageRequest.of(0, 3));

        // Then
        assertThat(page).hasSize(3);
        assertThat(page).extracting(PointBatch::getExpiresAt).isSorted();
    }

    @Test
    @DisplayName("findUpcomingExpirations - Returns batches expiring within the window")
    void findUpcomingExpirations_ReturnsBatchesWithinWindow() {
        // Given
        PointBatch soon = pointBatchRepository.save(batch("user_001", 10, now.plusDays(3)));
        PointBatch edge = pointBatchRepository.save(batch("user_001", 10, now.plusDays(30)));
        pointBatchRepository.save(batch("user_001", 10, now.plusDays(31)));
        pointBatchRepository.save(batch("user_001", 10, now.minusDays(1)));
        pointBatchRepository.save(batch("user_001", 10, null));

        // When
        List<PointBatch> upcoming = pointBatchRepository.findUpcomingExpirations(
                "user_001", PointBatchStatus.ACTIVE, now, now.plusDays(30));

        // Then
        assertThat(upcoming).extracting(PointBatch::getId).containsExactly(soon.getId(), edge.getId());
    }

    @Test
    @DisplayName("sumSpendableAmount - Sums only ACTIVE unexpired batches")
    void sumSpendableAmount_SumsOnlyActiveUnexpiredBatches() {
        // Given
        pointBatchRepository.save(batch("user_001", 10, now.plusDays(1)));
        pointBatchRepository.save(batch("user_001", 25, null));
        pointBatchRepository.save(batch("user_001", 40, now.minusMinutes(1)));  // 已到期，尚未清掃
        PointBatch expired = batch("user_001", 0, now.minusDays(1));
        expired.setStatus(PointBatchStatus.EXPIRED);
        expired.setForfeitedAmount(10L);
        pointBatchRepository.save(expired);

        // When & Then
        assertThat(pointBatchRepository.sumSpendableAmount("user_001", PointBatchStatus.ACTIVE, now)).isEqualTo(35L);
    }

    @Test
    @DisplayName("sumSpendableAmount - Without batches - Returns zero")
    void sumSpendableAmount_WithoutBatches_ReturnsZero() {
        assertThat(pointBatchRepository.sumSpendableAmount("nobody", PointBatchStatus.ACTIVE, now)).isZero();
    }

    private PointBatch batch(String userId, long remaining, LocalDateTime expiresAt) {
        return PointBatch.builder()
                .userId(userId)
                .originalAmount(Math.max(remaining, 10))
                .remainingAmount(remaining)
                .forfeitedAmount(0L)
                .sourceType(PointBatchSource.ADMIN_GRANT)
                .status(PointBatchStatus.ACTIVE)
                .issuedAt(now.minusDays(60))
                .expiresAt(expiresAt)
                .updatedAt(now)
                .build();
    }
}
