package com.example.pointledger.facade;

import com.example.pointledger.facade.dto.GetBalanceResponse;
import com.example.pointledger.facade.dto.GrantPointsRequest;
import com.example.pointledger.facade.dto.PointBatchDto;
import com.example.pointledger.facade.dto.UpcomingExpirationsResponse;

/**
 * Point Facade
 *
 * 職責：
 * 1. 發放點數（建立批次）
 * 2. 查詢衍生餘額
 * 3. 查詢即將過期的點數
 *
 * 暫時性儲存錯誤（鎖等待逾時、死結）由 Resilience4j ledgerStorage 重試。
 */
public interface PointFacade {

    /**
     * 發放點數
     *
     * @param request 發放參數（sourceType 未提供時為 ADMIN_GRANT）
     * @return 建立的批次
     * @throws com.example.pointledger.exception.InvalidAmountException amount <= 0
     */
    PointBatchDto grantPoints(GrantPointsRequest request);

    GetBalanceResponse getBalance(String userId);

    UpcomingExpirationsResponse getUpcomingExpirations(String userId);
}
