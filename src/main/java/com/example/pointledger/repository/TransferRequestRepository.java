package com.example.pointledger.repository;

import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.entity.TransferRequestStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * TransferRequestRepository
 *
 * 功能：提供 TransferRequest 實體的資料存取方法
 *
 * 自訂查詢方法：
 * 1. findByFromUserIdAndIdempotencyKey - 冪等性檢查
 * 2. compareAndSetStatus - 以預期狀態為條件的狀態轉換（CAS）
 * 3. findPendingPastExpiry - 清掃排程
 * 4. findPendingForRecipient / findByFromUserIdOrderByCreatedAtDesc - 查詢清單
 */
@Repository
public interface TransferRequestRepository extends JpaRepository<TransferRequest, Long> {

    /**
     * 根據付款方與冪等 key 查詢轉帳請求
     *
     * 配合資料庫唯一約束 (from_user_id, idempotency_key) 確保冪等性
     *
     * @param fromUserId     付款方使用者 ID
     * @param idempotencyKey 冪等 key
     * @return Optional<TransferRequest> 既有請求（如果有）
     */
    Optional<TransferRequest> findByFromUserIdAndIdempotencyKey(String fromUserId, String idempotencyKey);

    /**
     * Compare-and-set 狀態轉換
     *
     * 只有當目前狀態等於 expected 時才更新，回傳受影響筆數（0 或 1）
     * 並發核准同一請求時，只有一個事務會得到 1
     *
     * @param id        轉帳請求 ID
     * @param expected  預期目前狀態
     * @param newStatus 新狀態
     * @param decidedAt 決定時間
     * @return 更新筆數
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferRequest t SET t.status = :newStatus, t.decidedAt = :decidedAt, t.updatedAt = :decidedAt " +
           "WHERE t.id = :id AND t.status = :expected")
    int compareAndSetStatus(
            @Param("id") Long id,
            @Param("expected") TransferRequestStatus expected,
            @Param("newStatus") TransferRequestStatus newStatus,
            @Param("decidedAt") LocalDateTime decidedAt
    );

    /**
     * 記錄核准後收款方獲得的批次
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferRequest t SET t.creditedBatchId = :batchId WHERE t.id = :id")
    int updateCreditedBatchId(@Param("id") Long id, @Param("batchId") Long batchId);

    /**
     * 查詢已超過有效期限仍為 PENDING 的請求
     *
     * @param status   轉帳請求狀態（PENDING）
     * @param now      目前時間
     * @param pageable 分頁參數
     * @return List<TransferRequest> 依 expiresAt 升序
     */
    @Query("SELECT t FROM TransferRequest t WHERE t.status = :status " +
           "AND t.expiresAt < :now " +
           "ORDER BY t.expiresAt ASC, t.id ASC")
    List<TransferRequest> findPendingPastExpiry(
            @Param("status") TransferRequestStatus status,
            @Param("now") LocalDateTime now,
            Pageable pageable
    );

    /**
     * 查詢收款方待核准且尚未過期的請求
     */
    @Query("SELECT t FROM TransferRequest t WHERE t.toUserId = :toUserId " +
           "AND t.status = :status AND t.expiresAt > :now " +
           "ORDER BY t.createdAt DESC")
    Page<TransferRequest> findPendingForRecipient(
            @Param("toUserId") String toUserId,
            @Param("status") TransferRequestStatus status,
            @Param("now") LocalDateTime now,
            Pageable pageable
    );

    Page<TransferRequest> findByFromUserIdOrderByCreatedAtDesc(String fromUserId, Pageable pageable);

    long countByToUserIdAndStatusAndExpiresAtAfter(String toUserId, TransferRequestStatus status, LocalDateTime now);
}
