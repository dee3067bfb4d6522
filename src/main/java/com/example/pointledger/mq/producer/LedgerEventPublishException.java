package com.example.pointledger.mq.producer;

/**
 * 帳本事件發送失敗
 */
public class LedgerEventPublishException extends RuntimeException {

    public LedgerEventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
