package com.example.pointledger.service.impl;

import com.example.pointledger.config.LedgerProperties;
import com.example.pointledger.entity.BatchConsumption;
import com.example.pointledger.entity.ConsumptionReferenceType;
import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchSource;
import com.example.pointledger.entity.PointBatchStatus;
import com.example.pointledger.event.PointBalanceChangeType;
import com.example.pointledger.event.PointBalanceChangedEvent;
import com.example.pointledger.exception.BatchAlreadyTerminalException;
import com.example.pointledger.exception.InvalidAmountException;
import com.example.pointledger.exception.PointBatchNotFoundException;
import com.example.pointledger.repository.BatchConsumptionRepository;
import com.example.pointledger.repository.PointBatchRepository;
import com.example.pointledger.service.PointBatchService;
import com.example.pointledger.service.model.ConsumptionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PointBatchService 實作類別
 *
 * 實作重點：
 * 1. 使用 @Transactional 確保資料一致性
 * 2. 悲觀鎖（findByUserIdAndStatusForUpdate / findByIdForUpdate）序列化同一使用者的異動
 * 3. FIFO 順序由 FifoConsumptionPlanner 決定
 * 4. 異動後發布 PointBalanceChangedEvent（提交後清除快取、發送 MQ）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PointBatchServiceImpl implements PointBatchService {

    private final PointBatchRepository pointBatchRepository;
    private final BatchConsumptionRepository batchConsumptionRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    @Override
    @Transactional
    public PointBatch createBatch(String userId, long amount, LocalDateTime expiresAt,
                                  PointBatchSource sourceType, String sourceReference) {
        if (amount <= 0) {
            throw new InvalidAmountException(amount);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        PointBatch batch = PointBatch.builder()
            .userId(userId)
            .originalAmount(amount)
            .remainingAmount(amount)
            .forfeitedAmount(0L)
            .sourceType(sourceType)
            .sourceReference(sourceReference)
            .status(PointBatchStatus.ACTIVE)
            .issuedAt(now)
            .expiresAt(expiresAt)
            .updatedAt(now)
            .build();

        PointBatch saved = pointBatchRepository.save(batch);

        eventPublisher.publishEvent(new PointBalanceChangedEvent(
            this, userId, PointBalanceChangeType.GRANTED, amount, saved.getId(), sourceReference));

        log.info("Created point batch: id={}, userId={}, amount={}, source={}, expiresAt={}",
            saved.getId(), userId, amount, sourceType, expiresAt);

        return saved;
    }

    @Override
    @Transactional
    public List<ConsumptionRecord> consumeFifo(String userId, long amount,
                                               ConsumptionReferenceType referenceType, String referenceId) {
        if (amount <= 0) {
            throw new InvalidAmountException(amount);
        }

        // 1. 鎖定付款方所有 ACTIVE 批次
        List<PointBatch> locked = pointBatchRepository.findByUserIdAndStatusForUpdate(userId, PointBatchStatus.ACTIVE);

        // 2. 規劃（不足時拋出 InsufficientBalanceException，尚未做任何異動）
        LocalDateTime now = LocalDateTime.now(clock);
        List<ConsumptionRecord> plan = FifoConsumptionPlanner.plan(userId, locked, amount, now);

        // 3. 依計畫扣除並寫入消費紀錄
        Map<Long, PointBatch> byId = locked.stream()
            .collect(Collectors.toMap(PointBatch::getId, Function.identity()));
        for (ConsumptionRecord record : plan) {
            PointBatch batch = byId.get(record.getBatchId());
            batch.setRemainingAmount(batch.getRemainingAmount() - record.getAmountTaken());
            if (batch.getRemainingAmount() == 0) {
                batch.setStatus(PointBatchStatus.CONSUMED);
            }
            batch.setUpdatedAt(now);
            pointBatchRepository.save(batch);

            batchConsumptionRepository.save(BatchConsumption.builder()
                .batchId(batch.getId())
                .userId(userId)
                .amount(record.getAmountTaken())
                .referenceType(referenceType)
                .referenceId(referenceId)
                .createdAt(now)
                .build());
        }

        eventPublisher.publishEvent(new PointBalanceChangedEvent(
            this, userId, PointBalanceChangeType.CONSUMED, amount, null, referenceId));

        log.info("Consumed points: userId={}, amount={}, batches={}, reference={}:{}",
            userId, amount, plan.size(), referenceType, referenceId);

        return plan;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PointBatch> findExpiredBatches(LocalDateTime before, int limit) {
        return pointBatchRepository.findExpiredBatches(PointBatchStatus.ACTIVE, before, PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public PointBatch markExpired(Long batchId) {
        PointBatch batch = pointBatchRepository.findByIdForUpdate(batchId)
            .orElseThrow(() -> new PointBatchNotFoundException(batchId));

        if (!batch.isActive()) {
            throw new BatchAlreadyTerminalException(batchId, batch.getStatus());
        }

        long forfeited = batch.getRemainingAmount();
        batch.setForfeitedAmount(forfeited);
        batch.setRemainingAmount(0L);
        batch.setStatus(PointBatchStatus.EXPIRED);
        batch.setUpdatedAt(LocalDateTime.now(clock));
        PointBatch saved = pointBatchRepository.save(batch);

        eventPublisher.publishEvent(new PointBalanceChangedEvent(
            this, batch.getUserId(), PointBalanceChangeType.FORFEITED, forfeited, batchId, null));

        log.info("Expired point batch: id={}, userId={}, forfeited={}", batchId, batch.getUserId(), forfeited);

        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PointBatch> findUpcomingExpirations(String userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return pointBatchRepository.findUpcomingExpirations(
            userId, PointBatchStatus.ACTIVE, now, now.plus(ledgerProperties.getUpcomingExpirationWindow()));
    }

    @Override
    @Cacheable(value = "balance", key = "#userId")
    @Transactional(readOnly = true)
    public Long getBalance(String userId) {
        return pointBatchRepository.sumSpendableAmount(userId, PointBatchStatus.ACTIVE, LocalDateTime.now(clock));
    }

    @Override
    @CacheEvict(value = "balance", key = "#userId")
    public void evictBalanceCache(String userId) {
        log.debug("evict balance cache, userId: {}", userId);
    }
}
