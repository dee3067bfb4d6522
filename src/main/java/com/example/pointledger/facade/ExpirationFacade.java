package com.example.pointledger.facade;

import com.example.pointledger.facade.dto.SweepResult;

import java.time.LocalDateTime;

/**
 * Expiration Facade
 *
 * 職責：驅動批次過期沒收與逾期轉帳請求的清掃
 */
public interface ExpirationFacade {

    /**
     * 執行一次過期清掃
     *
     * 執行步驟：
     * 1. 分頁查詢 expiresAt < now 的 ACTIVE 批次
     * 2. 逐筆 markExpired（每筆獨立事務，失敗者記錄後略過）
     * 3. 分頁將逾期的 PENDING 請求轉為 EXPIRED
     *
     * 重複執行只會影響仍為 ACTIVE / PENDING 的資料。
     *
     * @param now       清掃基準時間
     * @param pageLimit 每頁筆數
     * @return 清掃摘要
     */
    SweepResult runExpirationSweep(LocalDateTime now, int pageLimit);
}
