package com.example.pointledger.repository;

import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * PointBatchRepository
 *
 * 功能：提供 PointBatch 實體的資料存取方法
 *
 * 自訂查詢方法：
 * 1. findByUserIdAndStatusForUpdate - 悲觀鎖定使用者的有效批次（FIFO 消費）
 * 2. findByIdForUpdate - 悲觀鎖定單一批次（過期沒收）
 * 3. findExpiredBatches - 清掃排程查詢已過期批次
 * 4. findUpcomingExpirations - 查詢即將過期的批次
 * 5. sumSpendableAmount - 計算衍生餘額
 */
@Repository
public interface PointBatchRepository extends JpaRepository<PointBatch, Long> {

    /**
     * 使用悲觀鎖定查詢使用者指定狀態的所有批次（FOR UPDATE）
     *
     * 用途：FIFO 消費前鎖定付款方批次，同一付款方的並發消費會在此序列化
     * 排序：依 id 升序取得鎖，避免不同事務以不同順序鎖定造成死結
     * FIFO 順序由 FifoConsumptionPlanner 在程式內決定
     *
     * @param userId 使用者 ID
     * @param status 批次狀態（通常為 ACTIVE）
     * @return List<PointBatch> 已鎖定的批次
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM PointBatch b WHERE b.userId = :userId AND b.status = :status ORDER BY b.id ASC")
    List<PointBatch> findByUserIdAndStatusForUpdate(
            @Param("userId") String userId,
            @Param("status") PointBatchStatus status
    );

    /**
     * 使用悲觀鎖定查詢單一批次（FOR UPDATE）
     *
     * @param id 批次 ID
     * @return Optional<PointBatch> 批次（帶鎖）
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM PointBatch b WHERE b.id = :id")
    Optional<PointBatch> findByIdForUpdate(@Param("id") Long id);

    /**
     * 查詢已過期但仍有剩餘點數的批次
     *
     * 條件：
     * 1. 狀態為指定狀態（ACTIVE）
     * 2. expiresAt < before
     * 3. remainingAmount > 0
     *
     * 排序：expiresAt 升序，再依 id
     *
     * @param status   批次狀態
     * @param before   截止時間
     * @param pageable 分頁參數（例如：PageRequest.of(0, 100)）
     * @return List<PointBatch> 過期批次
     */
    @Query("SELECT b FROM PointBatch b WHERE b.status = :status " +
           "AND b.expiresAt < :before " +
           "AND b.remainingAmount > 0 " +
           "ORDER BY b.expiresAt ASC, b.id ASC")
    List<PointBatch> findExpiredBatches(
            @Param("status") PointBatchStatus status,
            @Param("before") LocalDateTime before,
            Pageable pageable
    );

    /**
     * 查詢使用者在時間區間內即將過期的批次（僅供顯示）
     *
     * @param userId 使用者 ID
     * @param status 批次狀態（ACTIVE）
     * @param from   起始時間（不含）
     * @param until  結束時間（含）
     * @return List<PointBatch> 依 expiresAt 升序
     */
    @Query("SELECT b FROM PointBatch b WHERE b.userId = :userId " +
           "AND b.status = :status " +
           "AND b.expiresAt IS NOT NULL " +
           "AND b.expiresAt > :from AND b.expiresAt <= :until " +
           "ORDER BY b.expiresAt ASC, b.id ASC")
    List<PointBatch> findUpcomingExpirations(
            @Param("userId") String userId,
            @Param("status") PointBatchStatus status,
            @Param("from") LocalDateTime from,
            @Param("until") LocalDateTime until
    );

    /**
     * 計算使用者可用餘額：ACTIVE 且尚未到期批次的 remainingAmount 總和
     *
     * @param userId 使用者 ID
     * @param status 批次狀態（ACTIVE）
     * @param now    目前時間
     * @return 可用點數（無批次時為 0）
     */
    @Query("SELECT COALESCE(SUM(b.remainingAmount), 0) FROM PointBatch b " +
           "WHERE b.userId = :userId AND b.status = :status " +
           "AND (b.expiresAt IS NULL OR b.expiresAt > :now)")
    Long sumSpendableAmount(
            @Param("userId") String userId,
            @Param("status") PointBatchStatus status,
            @Param("now") LocalDateTime now
    );

    List<PointBatch> findByUserIdOrderByIdAsc(String userId);
}
