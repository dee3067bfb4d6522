package com.example.pointledger.event;

import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.entity.TransferRequestStatus;
import com.example.pointledger.service.impl.TransferRequestStateTransitionValidator;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 轉帳請求狀態變更事件
 *
 * 用途：
 * 建立請求或請求離開 PENDING 後發布，事務提交後由監聽器通知下游
 *
 * 事件流程：
 * 1. TransferRequestService 在事務中完成 compare-and-set 並發布事件
 * 2. 事務提交
 * 3. @TransactionalEventListener 接收事件
 * 4. 發送 MQ 通知
 */
@Getter
public class TransferRequestStatusChangedEvent extends ApplicationEvent {

    private final Long transferRequestId;

    private final String fromUserId;

    private final String toUserId;

    private final Long amount;

    /**
     * 舊狀態（轉換前）
     * null 表示新建請求
     */
    private final TransferRequestStatus oldStatus;

    private final TransferRequestStatus newStatus;

    /**
     * @param source    事件來源（通常是 TransferRequestService）
     * @param request   轉帳請求（包含最新狀態）
     * @param oldStatus 舊狀態（null 表示新建）
     */
    public TransferRequestStatusChangedEvent(Object source, TransferRequest request, TransferRequestStatus oldStatus) {
        super(source);
        this.transferRequestId = request.getId();
        this.fromUserId = request.getFromUserId();
        this.toUserId = request.getToUserId();
        this.amount = request.getAmount();
        this.oldStatus = oldStatus;
        this.newStatus = request.getStatus();
    }

    public boolean isTerminalState() {
        return TransferRequestStateTransitionValidator.isTerminalState(newStatus);
    }
}
