package com.example.pointledger.mq.msg;

import com.example.pointledger.entity.TransferRequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 轉帳請求狀態變更訊息
 *
 * Topic: point-ledger-events，Tag: TRANSFER_REQUEST_STATUS
 * 用途：通知收款方有新請求、通知付款方請求已被決定
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequestStatusMsg implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long transferRequestId;

    private String fromUserId;

    private String toUserId;

    private Long amount;

    /**
     * 舊狀態（null 表示新建）
     */
    private TransferRequestStatus oldStatus;

    private TransferRequestStatus newStatus;

    /**
     * 時間戳（Unix epoch milliseconds）
     */
    private long timestamp;
}
