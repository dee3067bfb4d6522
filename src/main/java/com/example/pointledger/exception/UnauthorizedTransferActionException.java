package com.example.pointledger.exception;

/**
 * 無權操作轉帳請求異常
 *
 * 使用場景：
 * - approve / reject：操作者不是收款方
 * - cancel：操作者不是付款方
 * - 查詢明細：查詢者既不是付款方也不是收款方
 */
public class UnauthorizedTransferActionException extends RuntimeException {

    private final Long transferRequestId;
    private final String actor;

    public UnauthorizedTransferActionException(Long transferRequestId, String actor, String action) {
        super(String.format("User %s is not allowed to %s transfer request %d", actor, action, transferRequestId));
        this.transferRequestId = transferRequestId;
        this.actor = actor;
    }

    public Long getTransferRequestId() {
        return transferRequestId;
    }

    public String getActor() {
        return actor;
    }
}
