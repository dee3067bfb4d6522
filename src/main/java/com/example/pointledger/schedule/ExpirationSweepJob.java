package com.example.pointledger.schedule;

import com.example.pointledger.config.SchedulerProperties;
import com.example.pointledger.facade.ExpirationFacade;
import com.example.pointledger.facade.dto.SweepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Expiration Sweep Scheduled Job
 *
 * 定時任務：沒收過期批次的剩餘點數，並將逾期的 PENDING 轉帳請求轉為 EXPIRED
 *
 * 職責：
 * - 按照配置的 cron 表達式定時觸發
 * - 以 ShedLock 確保同一時間只有一個實例執行
 * - 委派給 ExpirationFacade.runExpirationSweep() 執行業務邏輯
 * - 捕獲並記錄執行過程中的異常
 *
 * 配置：
 * - scheduler.expiration-sweeper.cron: 定時執行的 cron 表達式
 * - scheduler.expiration-sweeper.page-size: 每頁筆數
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirationSweepJob {

    private final ExpirationFacade expirationFacade;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    @Scheduled(cron = "${scheduler.expiration-sweeper.cron}")
    @SchedulerLock(
        name = "runExpirationSweep",
        lockAtMostFor = "${scheduler.expiration-sweeper.lock-at-most-seconds}s",
        lockAtLeastFor = "${scheduler.expiration-sweeper.lock-at-least-seconds}s"
    )
    public void runExpirationSweep() {
        log.info("Starting scheduled expiration sweep (lock acquired)");

        try {
            SweepResult result = expirationFacade.runExpirationSweep(
                    LocalDateTime.now(clock),
                    schedulerProperties.getPageSize()
            );

            log.info("Scheduled expiration sweep completed: expiredBatches={}, forfeitedPoints={}, expiredRequests={}",
                    result.getExpiredBatches(), result.getForfeitedPoints(), result.getExpiredRequests());
        } catch (Exception e) {
            log.error("Expiration sweep scheduled job failed: {}", e.getMessage(), e);
        }
    }
}
