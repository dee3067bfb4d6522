package com.example.pointledger.exception;

/**
 * 點數批次不存在異常
 */
public class PointBatchNotFoundException extends RuntimeException {

    public PointBatchNotFoundException(Long batchId) {
        super("Point batch not found: " + batchId);
    }
}
