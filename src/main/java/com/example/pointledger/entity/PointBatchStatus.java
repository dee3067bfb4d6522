package com.example.pointledger.entity;

/**
 * 點數批次狀態枚舉
 *
 * 狀態轉換：
 * ACTIVE → CONSUMED（消費至剩餘 0）
 * ACTIVE → EXPIRED（由過期清掃排程處理）
 *
 * CONSUMED 與 EXPIRED 皆為終態，且互斥。
 */
public enum PointBatchStatus {

    /**
     * 有效，可被 FIFO 消費
     */
    ACTIVE,

    /**
     * 已全數消費（remainingAmount = 0）
     * - 終態
     */
    CONSUMED,

    /**
     * 已過期，剩餘點數已沒收（forfeitedAmount）
     * - 終態
     */
    EXPIRED
}
