package com.example.pointledger.exception;

/**
 * 轉帳請求已被決定異常
 *
 * 請求已離開 PENDING 時拋出：讀取時已是終態，或 compare-and-set 落敗
 */
public class TransferRequestAlreadyDecidedException extends RuntimeException {

    private final Long transferRequestId;

    public TransferRequestAlreadyDecidedException(Long transferRequestId) {
        super("Transfer request already decided: " + transferRequestId);
        this.transferRequestId = transferRequestId;
    }

    public Long getTransferRequestId() {
        return transferRequestId;
    }
}
