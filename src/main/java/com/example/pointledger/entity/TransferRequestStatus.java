package com.example.pointledger.entity;

/**
 * 轉帳請求狀態枚舉
 *
 * 狀態轉換：
 * PENDING → APPROVED / REJECTED / CANCELLED / EXPIRED
 *
 * 除 PENDING 外皆為終態，每筆請求只會離開 PENDING 一次。
 */
public enum TransferRequestStatus {

    /**
     * 等待收款方核准
     * - 可轉換為：APPROVED, REJECTED, CANCELLED, EXPIRED
     */
    PENDING,

    /**
     * 收款方已核准，點數已從付款方移轉
     * - 終態 ✓
     */
    APPROVED,

    /**
     * 收款方拒絕
     * - 終態 ✗
     */
    REJECTED,

    /**
     * 付款方取消
     * - 終態 ✗
     */
    CANCELLED,

    /**
     * 超過 expiresAt 未處理，由清掃排程標記
     * - 終態 ✗
     */
    EXPIRED
}
