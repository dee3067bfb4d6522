package com.example.pointledger.exception;

/**
 * 點數不足異常
 *
 * 使用場景：
 * 1. consumeFifo() 可用批次總和不足，未做任何扣除
 * 2. 建立轉帳請求時的非約束性餘額檢查
 * 3. 核准轉帳時付款方點數已不足（整個事務回滾）
 */
public class InsufficientBalanceException extends RuntimeException {

    private final String userId;
    private final long available;
    private final long required;

    public InsufficientBalanceException(String userId, long available, long required) {
        super(String.format("Insufficient points for user: %s (available: %d, required: %d)",
            userId, available, required));
        this.userId = userId;
        this.available = available;
        this.required = required;
    }

    public String getUserId() {
        return userId;
    }

    public long getAvailable() {
        return available;
    }

    public long getRequired() {
        return required;
    }
}
