package com.example.pointledger.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * PointBatch 實體（點數批次表）
 *
 * 功能：以批次為單位追蹤每次發放的點數，支援 FIFO 消費與過期沒收
 * 餘額：使用者餘額 = 該使用者所有 ACTIVE 批次的 remainingAmount 總和（不另存）
 *
 * 不變條件：
 * - 0 <= remainingAmount <= originalAmount
 * - remainingAmount 建立後只減不增
 * - CONSUMED 僅在消費至 0 時進入；EXPIRED 僅由清掃排程進入
 */
@Entity
@Table(name = "point_batches", indexes = {
        // FIFO 消費：WHERE user_id = ? AND status = 'ACTIVE' FOR UPDATE
        @Index(name = "idx_user_status", columnList = "user_id, status"),

        // 過期清掃：WHERE status = 'ACTIVE' AND expires_at < ? ORDER BY expires_at
        @Index(name = "idx_status_expires_at", columnList = "status, expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointBatch {

    /**
     * 批次 ID（主鍵，自增）
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 持有者使用者 ID
     */
    @Column(name = "user_id", nullable = false, length = 50)
    private String userId;

    /**
     * 發放點數（> 0，不可更新）
     */
    @Column(name = "original_amount", nullable = false, updatable = false)
    private Long originalAmount;

    /**
     * 剩餘可用點數
     */
    @Column(name = "remaining_amount", nullable = false)
    private Long remainingAmount;

    /**
     * 過期時被沒收的點數（未過期時為 0）
     */
    @Column(name = "forfeited_amount", nullable = false)
    private Long forfeitedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 20)
    private PointBatchSource sourceType;

    /**
     * 來源參考（例如轉帳請求 ID），可為 null
     */
    @Column(name = "source_reference", length = 100)
    private String sourceReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PointBatchStatus status;

    /**
     * 發放時間（FIFO 次要排序鍵）
     */
    @Column(name = "issued_at", nullable = false, updatable = false)
    private LocalDateTime issuedAt;

    /**
     * 過期時間（null 表示永不過期）
     */
    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 樂觀鎖版本號
     */
    @Version
    private Long version;

    public boolean isActive() {
        return status == PointBatchStatus.ACTIVE;
    }

    /**
     * 判斷批次在指定時間點是否已過期（永不過期的批次回傳 false）
     */
    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
