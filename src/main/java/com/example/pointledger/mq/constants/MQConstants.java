package com.example.pointledger.mq.constants;

/**
 * RocketMQ 常數定義
 *
 * 集中管理 Topic 與 Tag 常數
 */
public final class MQConstants {

    private MQConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ==================== Topics ====================

    /**
     * 帳本事件 Topic
     * 用途：通知下游點數餘額變動與轉帳請求狀態變更
     */
    public static final String TOPIC_POINT_LEDGER_EVENTS = "point-ledger-events";

    // ==================== Tags ====================

    /**
     * 點數餘額變動（發放、消費、過期沒收）
     */
    public static final String TAG_BALANCE_CHANGED = "BALANCE_CHANGED";

    /**
     * 轉帳請求狀態變更
     */
    public static final String TAG_TRANSFER_REQUEST_STATUS = "TRANSFER_REQUEST_STATUS";
}
