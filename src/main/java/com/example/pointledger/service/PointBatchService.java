package com.example.pointledger.service;

import com.example.pointledger.entity.ConsumptionReferenceType;
import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchSource;
import com.example.pointledger.service.model.ConsumptionRecord;

import java.time.LocalDateTime;
import java.util.List;

/**
 * PointBatchService 介面（點數批次帳本）
 *
 * 功能：唯一可以異動 PointBatch 的元件
 *
 * 職責：
 * 1. 建立點數批次
 * 2. FIFO 消費（悲觀鎖）
 * 3. 查詢與標記過期批次
 * 4. 查詢衍生餘額（Redis 快取）
 *
 * 設計原則：
 * - 每個異動方法都是一個原子性操作（@Transactional）
 * - 呼叫端已在事務中時加入該事務（例如核准轉帳）
 */
public interface PointBatchService {

    /**
     * 建立 ACTIVE 點數批次
     *
     * @param userId          持有者
     * @param amount          點數（> 0）
     * @param expiresAt       過期時間，null 表示永不過期
     * @param sourceType      來源類型
     * @param sourceReference 來源參考，可為 null
     * @return PointBatch 建立的批次
     * @throws com.example.pointledger.exception.InvalidAmountException amount <= 0
     */
    PointBatch createBatch(String userId, long amount, LocalDateTime expiresAt,
                           PointBatchSource sourceType, String sourceReference);

    /**
     * FIFO 消費使用者點數
     *
     * 執行步驟：
     * 1. 悲觀鎖定使用者所有 ACTIVE 批次
     * 2. 排除已到期批次，依 (expiresAt 升序，null 最後, issuedAt, id) 排序
     * 3. 依序扣除直到滿足 amount
     * 4. 剩餘歸 0 的批次標記為 CONSUMED
     * 5. 寫入 BatchConsumption 紀錄
     *
     * @param userId        付款方
     * @param amount        消費點數（> 0）
     * @param referenceType 觸發消費的業務類型
     * @param referenceId   觸發消費的業務 ID
     * @return 每個被扣除批次的消費紀錄（FIFO 順序）
     * @throws com.example.pointledger.exception.InsufficientBalanceException 可用點數不足（不做任何扣除）
     * @throws com.example.pointledger.exception.InvalidAmountException amount <= 0
     */
    List<ConsumptionRecord> consumeFifo(String userId, long amount,
                                        ConsumptionReferenceType referenceType, String referenceId);

    /**
     * 查詢 expiresAt < before 且仍有剩餘點數的 ACTIVE 批次
     *
     * @param before 截止時間
     * @param limit  最多筆數
     * @return 依 expiresAt 升序
     */
    List<PointBatch> findExpiredBatches(LocalDateTime before, int limit);

    /**
     * 將批次標記為過期並沒收剩餘點數
     *
     * 狀態轉換：ACTIVE → EXPIRED，forfeited = remaining，remaining = 0
     *
     * @param batchId 批次 ID
     * @return PointBatch 更新後的批次
     * @throws com.example.pointledger.exception.PointBatchNotFoundException 批次不存在
     * @throws com.example.pointledger.exception.BatchAlreadyTerminalException 批次不是 ACTIVE
     */
    PointBatch markExpired(Long batchId);

    /**
     * 查詢使用者在提醒區間內即將過期的 ACTIVE 批次（僅供顯示）
     *
     * @param userId 使用者 ID
     * @return 依 expiresAt 升序
     */
    List<PointBatch> findUpcomingExpirations(String userId);

    /**
     * 查詢使用者可用餘額（使用 Spring Cache）
     *
     * @param userId 使用者 ID
     * @return 未到期 ACTIVE 批次剩餘點數總和，無批次時為 0
     */
    Long getBalance(String userId);

    /**
     * 清除使用者餘額快取
     */
    void evictBalanceCache(String userId);
}
