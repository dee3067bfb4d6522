package com.example.pointledger.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * TransferRequest 實體（轉帳請求表）
 *
 * 功能：記錄付款方發起、等待收款方核准的點數轉帳請求
 * 狀態流程：PENDING → APPROVED / REJECTED / CANCELLED / EXPIRED
 *
 * 冪等性設計：
 * - 唯一約束 (from_user_id, idempotency_key)
 * - 同一付款方以相同 key 重送時，回傳既有請求
 * - payload_fingerprint 用於判斷重送內容是否一致
 */
@Entity
@Table(name = "transfer_requests",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_from_user_idempotency_key",
                columnNames = {"from_user_id", "idempotency_key"}
        ),
        indexes = {
                // 清掃排程：WHERE status = 'PENDING' AND expires_at < ?
                @Index(name = "idx_status_expires_at", columnList = "status, expires_at"),

                // 收款方待核准清單：WHERE to_user_id = ? AND status = 'PENDING'
                @Index(name = "idx_to_user_status", columnList = "to_user_id, status"),

                // 付款方送出清單：WHERE from_user_id = ? ORDER BY created_at DESC
                @Index(name = "idx_from_user_created_at", columnList = "from_user_id, created_at DESC")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {

    /**
     * 轉帳請求 ID（主鍵，自增）
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 付款方使用者 ID
     */
    @Column(name = "from_user_id", nullable = false, length = 50)
    private String fromUserId;

    /**
     * 收款方使用者 ID（不可與付款方相同）
     */
    @Column(name = "to_user_id", nullable = false, length = 50)
    private String toUserId;

    /**
     * 轉帳點數（> 0）
     */
    @Column(nullable = false)
    private Long amount;

    /**
     * 附言（可為 null）
     */
    @Column(length = 255)
    private String message;

    @Column(name = "idempotency_key", nullable = false, length = 100)
    private String idempotencyKey;

    /**
     * 請求內容指紋（toUserId / amount / message）
     */
    @Column(name = "payload_fingerprint", nullable = false, length = 64)
    private String payloadFingerprint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransferRequestStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 有效期限（建立時間 + ttl）
     */
    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    /**
     * 離開 PENDING 的時間（可為 null）
     */
    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    /**
     * 核准後收款方獲得的批次 ID（可為 null）
     */
    @Column(name = "credited_batch_id")
    private Long creditedBatchId;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isPending() {
        return status == TransferRequestStatus.PENDING;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
