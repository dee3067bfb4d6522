package com.example.pointledger.mq.msg;

import com.example.pointledger.event.PointBalanceChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 點數餘額變動訊息
 *
 * Topic: point-ledger-events，Tag: BALANCE_CHANGED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointBalanceChangedMsg implements Serializable {
    private static final long serialVersionUID = 1L;

    private String userId;

    private PointBalanceChangeType type;

    /**
     * 變動點數（正數）
     */
    private Long amount;

    /**
     * 相關批次 ID（消費跨多個批次時為 null）
     */
    private Long batchId;

    /**
     * 業務參考（例如轉帳請求 ID）
     */
    private String reference;

    /**
     * 時間戳（Unix epoch milliseconds）
     */
    private long timestamp;
}
