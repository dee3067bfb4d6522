package com.example.pointledger.exception;

/**
 * 自我轉帳異常：付款方與收款方相同
 */
public class SelfTransferException extends IllegalArgumentException {

    public SelfTransferException(String userId) {
        super(String.format("Cannot transfer points to yourself: userId=%s", userId));
    }
}
