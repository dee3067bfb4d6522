package com.example.pointledger.exception;

/**
 * 冪等 key 衝突異常
 *
 * 同一付款方以相同 idempotencyKey 重送，但請求內容（收款方、點數、附言）不同時拋出
 */
public class ConflictingIdempotencyKeyException extends RuntimeException {

    private final String fromUserId;
    private final String idempotencyKey;
    private final Long existingRequestId;

    public ConflictingIdempotencyKeyException(String fromUserId, String idempotencyKey, Long existingRequestId) {
        super(String.format("Idempotency key already used with a different payload: fromUserId=%s, key=%s, existingRequestId=%d",
            fromUserId, idempotencyKey, existingRequestId));
        this.fromUserId = fromUserId;
        this.idempotencyKey = idempotencyKey;
        this.existingRequestId = existingRequestId;
    }

    public String getFromUserId() {
        return fromUserId;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public Long getExistingRequestId() {
        return existingRequestId;
    }
}
