package com.example.pointledger.event;

import com.example.pointledger.mq.producer.LedgerEventProducer;
import com.example.pointledger.service.PointBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 點數餘額變動監聽器
 *
 * 監聽 PointBalanceChangedEvent，在事務提交後執行：
 * 1. 快取失效
 * 2. 發送 RocketMQ 通知
 *
 * 快取清除在 MQ 發送之前執行，下游收到通知時讀到的是新餘額。
 * 兩個步驟的失敗都只記錄，帳本事務已提交，不回滾。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PointBalanceChangedListener {

    private final LedgerEventProducer producer;
    private final PointBatchService pointBatchService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handlePointBalanceChanged(PointBalanceChangedEvent event) {
        // 1. 快取失效
        try {
            pointBatchService.evictBalanceCache(event.getUserId());
        } catch (Exception e) {
            log.error("Failed to evict balance cache: userId={}, type={}",
                event.getUserId(), event.getChangeType(), e);
        }

        // 2. 發送 MQ 通知
        try {
            producer.sendBalanceChanged(event);
        } catch (Exception e) {
            log.error("Failed to send balance changed to MQ: userId={}, type={}, amount={}",
                event.getUserId(), event.getChangeType(), event.getAmount(), e);
        }
    }
}
