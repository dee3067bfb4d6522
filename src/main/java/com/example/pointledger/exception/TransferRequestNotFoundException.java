package com.example.pointledger.exception;

/**
 * 轉帳請求不存在異常
 *
 * 當嘗試操作或查詢不存在的轉帳請求時拋出此異常
 *
 * 使用場景：
 * - approve / reject / cancel 找不到指定的請求
 * - findById() 找不到指定的請求
 */
public class TransferRequestNotFoundException extends RuntimeException {

    /**
     * 建立轉帳請求不存在異常
     *
     * @param transferRequestId 找不到的轉帳請求 ID
     */
    public TransferRequestNotFoundException(Long transferRequestId) {
        super("Transfer request not found: " + transferRequestId);
    }
}
