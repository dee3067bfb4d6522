package com.example.pointledger.facade.impl;

import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.exception.BatchAlreadyTerminalException;
import com.example.pointledger.facade.ExpirationFacade;
import com.example.pointledger.facade.dto.SweepResult;
import com.example.pointledger.service.PointBatchService;
import com.example.pointledger.service.TransferRequestService;
import com.example.pointledger.service.model.StaleExpiryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ExpirationFacade 實作
 *
 * 每個批次在自己的事務中過期（PointBatchService.markExpired），一次只鎖一列。
 * 失敗的批次記錄後略過，留待下次清掃。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirationFacadeImpl implements ExpirationFacade {

    private final PointBatchService pointBatchService;
    private final TransferRequestService transferRequestService;

    @Override
    public SweepResult runExpirationSweep(LocalDateTime now, int pageLimit) {
        if (pageLimit <= 0) {
            throw new IllegalArgumentException("Page limit must be positive: " + pageLimit);
        }
        log.info("Running expiration sweep: now={}, pageLimit={}", now, pageLimit);

        SweepResult result = new SweepResult();
        sweepBatches(now, pageLimit, result);
        sweepTransferRequests(now, pageLimit, result);

        log.info("Expiration sweep finished: expiredBatches={}, forfeitedPoints={}, expiredRequests={}",
                result.getExpiredBatches(), result.getForfeitedPoints(), result.getExpiredRequests());
        return result;
    }

    private void sweepBatches(LocalDateTime now, int pageLimit, SweepResult result) {
        // 本次清掃中處理失敗的批次仍為 ACTIVE，會再次出現在查詢結果前段
        Set<Long> skipped = new HashSet<>();

        while (true) {
            int requested = pageLimit + skipped.size();
            List<PointBatch> page = pointBatchService.findExpiredBatches(now, requested);
            List<PointBatch> pending = page.stream()
                    .filter(batch -> !skipped.contains(batch.getId()))
                    .toList();
            if (pending.isEmpty()) {
                break;
            }

            for (PointBatch batch : pending) {
                try {
                    PointBatch expired = pointBatchService.markExpired(batch.getId());
                    result.setExpiredBatches(result.getExpiredBatches() + 1);
                    result.setForfeitedPoints(result.getForfeitedPoints() + expired.getForfeitedAmount());
                } catch (BatchAlreadyTerminalException e) {
                    log.info("Batch left ACTIVE before expiry: batchId={}, status={}", batch.getId(), e.getStatus());
                } catch (Exception e) {
                    log.error("Failed to expire batch {}: {}", batch.getId(), e.getMessage(), e);
                    skipped.add(batch.getId());
                }
            }

            if (page.size() < requested) {
                break;
            }
        }

        if (!skipped.isEmpty()) {
            log.warn("Batches skipped during expiration sweep: count={}, ids={}", skipped.size(), skipped);
        }
    }

    private void sweepTransferRequests(LocalDateTime now, int pageLimit, SweepResult result) {
        // CAS 落敗的請求已離開 PENDING，不會再被查到，因此以候選筆數判斷是否還有下一頁
        StaleExpiryResult page;
        do {
            page = transferRequestService.expireStale(now, pageLimit);
            result.setExpiredRequests(result.getExpiredRequests() + page.getExpired());
        } while (page.getCandidates() == pageLimit);
    }
}
