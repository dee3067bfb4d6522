package com.example.pointledger.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次過期清掃的結果摘要
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepResult {

    /**
     * 標記為 EXPIRED 的批次數
     */
    private int expiredBatches;

    /**
     * 沒收的點數總和
     */
    private long forfeitedPoints;

    /**
     * 轉為 EXPIRED 的轉帳請求數
     */
    private int expiredRequests;
}
