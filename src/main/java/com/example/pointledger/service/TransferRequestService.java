package com.example.pointledger.service;

import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.service.model.Registration;
import com.example.pointledger.service.model.StaleExpiryResult;
import org.springframework.data.domain.Page;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * TransferRequestService 介面
 *
 * 功能：轉帳請求狀態機，唯一可以轉換 TransferRequest 狀態的元件
 *
 * 職責：
 * 1. 建立 PENDING 請求（經由 IdempotencyRegistry 去重）
 * 2. 核准：同一事務內 FIFO 扣除付款方點數、為收款方建立新批次、CAS PENDING → APPROVED
 * 3. 拒絕 / 取消：CAS，不移動點數
 * 4. 將逾期的 PENDING 請求轉為 EXPIRED
 * 5. 查詢
 *
 * 狀態轉換一律以資料庫 compare-and-set（條件 UPDATE）執行，失敗時拋出
 * TransferRequestAlreadyDecidedException。
 */
public interface TransferRequestService {

    /**
     * 建立轉帳請求
     *
     * 執行步驟：
     * 1. 驗證 from != to、amount > 0、idempotencyKey 非空白
     * 2. 冪等登記：重送直接回傳既有請求（不再檢查餘額）
     * 3. 非約束性餘額檢查（不預留點數）
     * 4. 插入 PENDING，expiresAt = now + ttl
     *
     * @return Registration（replayed 表示重送）
     * @throws com.example.pointledger.exception.SelfTransferException from == to
     * @throws com.example.pointledger.exception.InvalidAmountException amount <= 0
     * @throws com.example.pointledger.exception.ConflictingIdempotencyKeyException 同 key 不同內容
     * @throws com.example.pointledger.exception.InsufficientBalanceException 付款方目前點數不足
     */
    Registration create(String fromUserId, String toUserId, long amount, String idempotencyKey,
                        Duration ttl, String message);

    /**
     * 核准轉帳請求（收款方操作）
     *
     * 狀態轉換：PENDING → APPROVED
     *
     * @throws com.example.pointledger.exception.TransferRequestNotFoundException 請求不存在
     * @throws com.example.pointledger.exception.UnauthorizedTransferActionException actor 不是收款方
     * @throws com.example.pointledger.exception.InvalidTransferRequestStateException 不是 PENDING 或已逾期
     * @throws com.example.pointledger.exception.TransferRequestAlreadyDecidedException CAS 失敗
     * @throws com.example.pointledger.exception.InsufficientBalanceException 付款方點數不足（整個事務回滾）
     */
    TransferRequest approve(Long id, String actor);

    /**
     * 拒絕轉帳請求（收款方操作）
     *
     * 狀態轉換：PENDING → REJECTED
     */
    TransferRequest reject(Long id, String actor);

    /**
     * 取消轉帳請求（付款方操作）
     *
     * 狀態轉換：PENDING → CANCELLED
     */
    TransferRequest cancel(Long id, String actor);

    /**
     * 將 expiresAt < now 的 PENDING 請求轉為 EXPIRED（一頁）
     *
     * @param now   目前時間
     * @param limit 本頁最多處理筆數
     * @return 本頁候選筆數與實際轉為 EXPIRED 的筆數
     */
    StaleExpiryResult expireStale(LocalDateTime now, int limit);

    /**
     * 查詢請求明細（viewer 必須是付款方或收款方）
     */
    TransferRequest findById(Long id, String viewer);

    /**
     * 收款方待核准且尚未逾期的請求，依建立時間新到舊
     */
    Page<TransferRequest> findPendingForRecipient(String toUserId, int page, int size);

    /**
     * 付款方送出的請求，依建立時間新到舊
     */
    Page<TransferRequest> findSentBy(String fromUserId, int page, int size);

    long countPendingForRecipient(String toUserId);
}
