package com.example.pointledger.exception;

/**
 * 轉帳請求狀態無效異常
 *
 * 當轉帳請求狀態不符合操作要求時拋出此異常
 *
 * 使用場景：
 * - approve / reject / cancel 一個已不是 PENDING 的請求
 * - approve 一個已超過有效期限的請求
 */
public class InvalidTransferRequestStateException extends RuntimeException {

    /**
     * 建立轉帳請求狀態無效異常
     *
     * @param message 錯誤訊息
     */
    public InvalidTransferRequestStateException(String message) {
        super(message);
    }
}
