package com.example.pointledger.service;

import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.service.model.Registration;

import java.util.function.Supplier;

/**
 * 冪等登記：以 (fromUserId, idempotencyKey) 去除重複的轉帳請求提交
 *
 * 結果：
 * - 無既有紀錄：插入新請求，回傳 created
 * - 相同 key 且內容指紋相同：回傳既有請求（replayed）
 * - 相同 key 但內容指紋不同：ConflictingIdempotencyKeyException
 *
 * 資料庫唯一約束是唯一的仲裁者：並發插入失敗的一方會重新讀取勝出者。
 */
public interface IdempotencyRegistry {

    /**
     * @param fromUserId     付款方
     * @param idempotencyKey 冪等 key
     * @param fingerprint    請求內容指紋
     * @param newRequest     僅在沒有既有紀錄時呼叫，建立待插入的請求（可在此做插入前檢查）
     * @return Registration
     * @throws com.example.pointledger.exception.ConflictingIdempotencyKeyException 同 key 不同內容
     */
    Registration register(String fromUserId, String idempotencyKey, String fingerprint,
                          Supplier<TransferRequest> newRequest);
}
