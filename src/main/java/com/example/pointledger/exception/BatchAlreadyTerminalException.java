package com.example.pointledger.exception;

import com.example.pointledger.entity.PointBatchStatus;

/**
 * 批次已為終態異常（CONSUMED / EXPIRED 不可再標記過期）
 */
public class BatchAlreadyTerminalException extends RuntimeException {

    private final Long batchId;
    private final PointBatchStatus status;

    public BatchAlreadyTerminalException(Long batchId, PointBatchStatus status) {
        super(String.format("Point batch already terminal: id=%d, status=%s", batchId, status));
        this.batchId = batchId;
        this.status = status;
    }

    public Long getBatchId() {
        return batchId;
    }

    public PointBatchStatus getStatus() {
        return status;
    }
}
