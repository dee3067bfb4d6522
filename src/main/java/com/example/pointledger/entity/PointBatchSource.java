package com.example.pointledger.entity;

/**
 * 點數批次來源
 */
public enum PointBatchSource {

    /**
     * 轉帳請求核准後，收款方獲得的新批次
     */
    TRANSFER,

    ADMIN_GRANT,

    DAILY_BONUS,

    SYSTEM_GRANT,

    /**
     * 既有餘額轉入批次制時建立
     */
    MIGRATION
}
