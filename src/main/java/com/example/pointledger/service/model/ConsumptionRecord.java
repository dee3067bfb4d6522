package com.example.pointledger.service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 單次 FIFO 消費自某一批次扣除的點數
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsumptionRecord {

    private Long batchId;

    /**
     * 自該批次扣除的點數（> 0）
     */
    private long amountTaken;

    /**
     * 來源批次的過期時間（null 表示永不過期），供轉帳入帳批次繼承
     */
    private LocalDateTime sourceExpiresAt;
}
