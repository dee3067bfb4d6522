package com.example.pointledger.facade;

import com.example.pointledger.facade.dto.CreateTransferRequestRequest;
import com.example.pointledger.facade.dto.CreateTransferRequestResponse;
import com.example.pointledger.facade.dto.PendingCountResponse;
import com.example.pointledger.facade.dto.TransferRequestDto;
import com.example.pointledger.facade.dto.TransferRequestPageResponse;

/**
 * Transfer Request Facade
 *
 * 職責：
 * 1. 建立 / 核准 / 拒絕 / 取消轉帳請求
 * 2. 查詢明細、收款方待核准清單、付款方送出清單、待核准數量
 * 3. 將實體轉換為 DTO，統一記錄錯誤日誌
 *
 * 設計原則：
 * - 委派給 TransferRequestService 進行狀態轉換
 * - 不直接呼叫 MQ producer（使用事件驅動）
 */
public interface TransferRequestFacade {

    /**
     * 建立轉帳請求
     *
     * @param request        請求內容
     * @param idempotencyKey 冪等 key
     * @return 建立結果（replayed 表示重送）
     * @throws com.example.pointledger.exception.ConflictingIdempotencyKeyException 同 key 不同內容
     * @throws com.example.pointledger.exception.InsufficientBalanceException 付款方點數不足
     */
    CreateTransferRequestResponse createTransferRequest(CreateTransferRequestRequest request, String idempotencyKey);

    TransferRequestDto approveTransferRequest(Long id, String actor);

    TransferRequestDto rejectTransferRequest(Long id, String actor);

    TransferRequestDto cancelTransferRequest(Long id, String actor);

    TransferRequestDto getTransferRequest(Long id, String viewer);

    TransferRequestPageResponse getPendingTransferRequests(String toUserId, int page, int size);

    TransferRequestPageResponse getSentTransferRequests(String fromUserId, int page, int size);

    PendingCountResponse getPendingTransferRequestCount(String toUserId);
}
