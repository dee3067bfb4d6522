package com.example.pointledger.exception;

/**
 * 點數金額無效異常
 *
 * 使用場景：
 * 1. createBatch() 發放點數 <= 0
 * 2. consumeFifo() 消費點數 <= 0
 * 3. 建立轉帳請求時 amount <= 0
 */
public class InvalidAmountException extends IllegalArgumentException {

    private final long amount;

    public InvalidAmountException(long amount) {
        super(String.format("Amount must be positive: %d", amount));
        this.amount = amount;
    }

    public long getAmount() {
        return amount;
    }
}
