package com.example.pointledger.event;

import com.example.pointledger.mq.producer.LedgerEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 轉帳請求狀態變更事件監聽器
 *
 * 在事務提交後記錄狀態轉換並通知下游（收款方的待核准提醒、付款方的結果通知）
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferRequestStatusChangedListener {

    private final LedgerEventProducer producer;

    /**
     * 執行時機：
     * - 只在事務成功提交後執行（TransactionPhase.AFTER_COMMIT）
     * - 建立請求時插入已在獨立事務中提交，發布時沒有進行中的事務，以 fallbackExecution 立即執行
     *
     * @param event 轉帳請求狀態變更事件
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleTransferRequestStatusChanged(TransferRequestStatusChangedEvent event) {
        log.info("Transfer request status changed: id={}, {} -> {}, terminal={}",
            event.getTransferRequestId(),
            event.getOldStatus(),
            event.getNewStatus(),
            event.isTerminalState());

        try {
            producer.sendTransferRequestStatus(event);
        } catch (Exception e) {
            log.error("Failed to send transfer request status to MQ: id={}, status={}",
                event.getTransferRequestId(), event.getNewStatus(), e);
        }
    }
}
