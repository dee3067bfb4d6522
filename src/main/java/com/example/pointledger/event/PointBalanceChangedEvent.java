package com.example.pointledger.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 點數餘額變動事件
 *
 * 用途：
 * 批次入帳、FIFO 消費或過期沒收後發布此事件，事務提交後：
 * 1. 清除該使用者的餘額快取
 * 2. 發送 MQ 餘額變動通知
 *
 * 事務 rollback 時監聽器不會執行，快取與下游不會看到未提交的變動。
 */
@Getter
public class PointBalanceChangedEvent extends ApplicationEvent {

    private final String userId;

    private final PointBalanceChangeType changeType;

    /**
     * 變動點數（正數）
     */
    private final long amount;

    /**
     * 相關批次 ID（消費跨多個批次時為 null）
     */
    private final Long batchId;

    /**
     * 業務參考（例如轉帳請求 ID），可為 null
     */
    private final String reference;

    public PointBalanceChangedEvent(Object source, String userId, PointBalanceChangeType changeType,
                                    long amount, Long batchId, String reference) {
        super(source);
        this.userId = userId;
        this.changeType = changeType;
        this.amount = amount;
        this.batchId = batchId;
        this.reference = reference;
    }
}
