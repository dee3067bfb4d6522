package com.example.pointledger.event;

/**
 * 點數餘額變動類型
 */
public enum PointBalanceChangeType {
    /**
     * 新批次入帳（發放或轉帳收款）
     */
    GRANTED,

    /**
     * FIFO 消費扣除
     */
    CONSUMED,

    /**
     * 過期沒收
     */
    FORFEITED
}
