package com.example.pointledger.entity;

/**
 * 觸發 FIFO 消費的業務類型
 */
public enum ConsumptionReferenceType {

    /**
     * 轉帳請求核准（referenceId = 轉帳請求 ID）
     */
    TRANSFER_REQUEST
}
