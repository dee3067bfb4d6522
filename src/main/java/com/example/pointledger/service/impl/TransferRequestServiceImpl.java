package com.example.pointledger.service.impl;

import com.example.pointledger.entity.ConsumptionReferenceType;
import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchSource;
import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.entity.TransferRequestStatus;
import com.example.pointledger.event.TransferRequestStatusChangedEvent;
import com.example.pointledger.exception.InsufficientBalanceException;
import com.example.pointledger.exception.InvalidAmountException;
import com.example.pointledger.exception.InvalidTransferRequestStateException;
import com.example.pointledger.exception.SelfTransferException;
import com.example.pointledger.exception.TransferRequestAlreadyDecidedException;
import com.example.pointledger.exception.TransferRequestNotFoundException;
import com.example.pointledger.exception.UnauthorizedTransferActionException;
import com.example.pointledger.repository.TransferRequestRepository;
import com.example.pointledger.service.IdempotencyRegistry;
import com.example.pointledger.service.PointBatchService;
import com.example.pointledger.service.TransferRequestService;
import com.example.pointledger.service.model.ConsumptionRecord;
import com.example.pointledger.service.model.Registration;
import com.example.pointledger.service.model.StaleExpiryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * TransferRequestService 實作類別
 *
 * 實作重點：
 * 1. 核准在單一 @Transactional 內完成：CAS、FIFO 扣除、收款方入帳，任一步失敗全部回滾
 * 2. CAS 先於扣除執行，並發核准的落敗者在條件 UPDATE 上等待，提交後看到 0 筆而失敗
 * 3. 狀態轉換前以 TransferRequestStateTransitionValidator 檢查
 * 4. 事件發布：狀態變更後發布 TransferRequestStatusChangedEvent
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferRequestServiceImpl implements TransferRequestService {

    private final TransferRequestRepository transferRequestRepository;
    private final PointBatchService pointBatchService;
    private final IdempotencyRegistry idempotencyRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public Registration create(String fromUserId, String toUserId, long amount, String idempotencyKey,
                               Duration ttl, String message) {
        if (fromUserId.equals(toUserId)) {
            throw new SelfTransferException(fromUserId);
        }
        if (amount <= 0) {
            throw new InvalidAmountException(amount);
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }

        String fingerprint = IdempotencyRegistryImpl.fingerprint(toUserId, amount, message);

        Registration registration = idempotencyRegistry.register(fromUserId, idempotencyKey, fingerprint, () -> {
            // 非約束性檢查：不預留點數，核准時才真正扣除
            long available = pointBatchService.getBalance(fromUserId);
            if (available < amount) {
                throw new InsufficientBalanceException(fromUserId, available, amount);
            }

            LocalDateTime now = LocalDateTime.now(clock);
            return TransferRequest.builder()
                .fromUserId(fromUserId)
                .toUserId(toUserId)
                .amount(amount)
                .message(message)
                .idempotencyKey(idempotencyKey)
                .payloadFingerprint(fingerprint)
                .status(TransferRequestStatus.PENDING)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .updatedAt(now)
                .build();
        });

        if (!registration.isReplayed()) {
            TransferRequest created = registration.getRequest();
            // 插入已在獨立事務中提交，監聽器以 fallbackExecution 立即處理
            eventPublisher.publishEvent(new TransferRequestStatusChangedEvent(this, created, null));
            log.info("Created transfer request: id={}, from={}, to={}, amount={}, expiresAt={}",
                created.getId(), fromUserId, toUserId, amount, created.getExpiresAt());
        }

        return registration;
    }

    @Override
    @Transactional
    public TransferRequest approve(Long id, String actor) {
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. 檢查操作者、狀態與有效期限
        TransferRequest request = loadForTransition(id, TransferRequestStatus.APPROVED);
        requireActor(request, request.getToUserId(), actor, "approve");
        if (request.isExpiredAt(now)) {
            log.warn("Cannot approve expired transfer request: id={}, expiresAt={}", id, request.getExpiresAt());
            throw new InvalidTransferRequestStateException(
                String.format("Cannot approve transfer request: id=%d. It expired at %s.", id, request.getExpiresAt()));
        }

        // 2. CAS PENDING → APPROVED
        compareAndSet(id, TransferRequestStatus.APPROVED, now);

        // 3. FIFO 扣除付款方點數（不足時拋出，連同 CAS 一起回滾）
        String reference = String.valueOf(id);
        List<ConsumptionRecord> records = pointBatchService.consumeFifo(
            request.getFromUserId(), request.getAmount(), ConsumptionReferenceType.TRANSFER_REQUEST, reference);

        // 4. 為收款方建立新批次，繼承來源批次中最早的過期時間
        LocalDateTime inheritedExpiry = records.stream()
            .map(ConsumptionRecord::getSourceExpiresAt)
            .filter(Objects::nonNull)
            .min(LocalDateTime::compareTo)
            .orElse(null);
        PointBatch credited = pointBatchService.createBatch(
            request.getToUserId(), request.getAmount(), inheritedExpiry, PointBatchSource.TRANSFER, reference);
        transferRequestRepository.updateCreditedBatchId(id, credited.getId());

        TransferRequest approved = transferRequestRepository.findById(id)
            .orElseThrow(() -> new TransferRequestNotFoundException(id));
        eventPublisher.publishEvent(new TransferRequestStatusChangedEvent(this, approved, TransferRequestStatus.PENDING));

        log.info("Approved transfer request: id={}, from={}, to={}, amount={}, creditedBatchId={}",
            id, approved.getFromUserId(), approved.getToUserId(), approved.getAmount(), credited.getId());

        return approved;
    }

    @Override
    @Transactional
    public TransferRequest reject(Long id, String actor) {
        TransferRequest request = loadForTransition(id, TransferRequestStatus.REJECTED);
        requireActor(request, request.getToUserId(), actor, "reject");
        return decideWithoutFunds(id, TransferRequestStatus.REJECTED);
    }

    @Override
    @Transactional
    public TransferRequest cancel(Long id, String actor) {
        TransferRequest request = loadForTransition(id, TransferRequestStatus.CANCELLED);
        requireActor(request, request.getFromUserId(), actor, "cancel");
        return decideWithoutFunds(id, TransferRequestStatus.CANCELLED);
    }

    @Override
    @Transactional
    public StaleExpiryResult expireStale(LocalDateTime now, int limit) {
        List<TransferRequest> candidates = transferRequestRepository.findPendingPastExpiry(
            TransferRequestStatus.PENDING, now, PageRequest.of(0, limit));

        int expired = 0;
        for (TransferRequest candidate : candidates) {
            int updated = transferRequestRepository.compareAndSetStatus(
                candidate.getId(), TransferRequestStatus.PENDING, TransferRequestStatus.EXPIRED, now);
            if (updated == 0) {
                log.debug("Transfer request decided before expiry: id={}", candidate.getId());
                continue;
            }
            candidate.setStatus(TransferRequestStatus.EXPIRED);
            candidate.setDecidedAt(now);
            eventPublisher.publishEvent(new TransferRequestStatusChangedEvent(this, candidate, TransferRequestStatus.PENDING));
            expired++;
        }

        if (expired > 0) {
            log.info("Expired stale transfer requests: count={}, candidates={}", expired, candidates.size());
        }
        return new StaleExpiryResult(candidates.size(), expired);
    }

    @Override
    @Transactional(readOnly = true)
    public TransferRequest findById(Long id, String viewer) {
        TransferRequest request = transferRequestRepository.findById(id)
            .orElseThrow(() -> new TransferRequestNotFoundException(id));
        if (!viewer.equals(request.getFromUserId()) && !viewer.equals(request.getToUserId())) {
            throw new UnauthorizedTransferActionException(id, viewer, "view");
        }
        return request;
    }

    @Override
    @Transactional(readOnly = true)
    public Page<TransferRequest> findPendingForRecipient(String toUserId, int page, int size) {
        return transferRequestRepository.findPendingForRecipient(
            toUserId, TransferRequestStatus.PENDING, LocalDateTime.now(clock), PageRequest.of(page, size));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<TransferRequest> findSentBy(String fromUserId, int page, int size) {
        return transferRequestRepository.findByFromUserIdOrderByCreatedAtDesc(fromUserId, PageRequest.of(page, size));
    }

    @Override
    @Transactional(readOnly = true)
    public long countPendingForRecipient(String toUserId) {
        return transferRequestRepository.countByToUserIdAndStatusAndExpiresAtAfter(
            toUserId, TransferRequestStatus.PENDING, LocalDateTime.now(clock));
    }

    /**
     * 內部輔助方法：讀取請求並確認狀態允許轉換到 target
     *
     * 終態請求拋出 TransferRequestAlreadyDecidedException，與並發 CAS 落敗者得到相同錯誤
     */
    private TransferRequest loadForTransition(Long id, TransferRequestStatus target) {
        TransferRequest request = transferRequestRepository.findById(id)
            .orElseThrow(() -> new TransferRequestNotFoundException(id));

        // 已離開 PENDING：與 CAS 落敗同屬「已被決定」
        if (TransferRequestStateTransitionValidator.isTerminalState(request.getStatus())) {
            log.warn("Transfer request already decided: id={}, status={}, target={}", id, request.getStatus(), target);
            throw new TransferRequestAlreadyDecidedException(id);
        }
        if (!TransferRequestStateTransitionValidator.isTransitionAllowed(request.getStatus(), target)) {
            log.warn("Invalid state transition: id={}, from={}, to={}", id, request.getStatus(), target);
            throw new InvalidTransferRequestStateException(
                String.format("Cannot move transfer request to %s: id=%d, current status=%s. Only PENDING requests can be decided.",
                    target, id, request.getStatus()));
        }
        return request;
    }

    private void requireActor(TransferRequest request, String expectedActor, String actor, String action) {
        if (!expectedActor.equals(actor)) {
            log.warn("Unauthorized transfer request action: id={}, action={}, actor={}", request.getId(), action, actor);
            throw new UnauthorizedTransferActionException(request.getId(), actor, action);
        }
    }

    private void compareAndSet(Long id, TransferRequestStatus target, LocalDateTime now) {
        int updated = transferRequestRepository.compareAndSetStatus(id, TransferRequestStatus.PENDING, target, now);
        if (updated == 0) {
            log.warn("Transfer request already decided: id={}, target={}", id, target);
            throw new TransferRequestAlreadyDecidedException(id);
        }
    }

    private TransferRequest decideWithoutFunds(Long id, TransferRequestStatus target) {
        compareAndSet(id, target, LocalDateTime.now(clock));

        TransferRequest decided = transferRequestRepository.findById(id)
            .orElseThrow(() -> new TransferRequestNotFoundException(id));
        eventPublisher.publishEvent(new TransferRequestStatusChangedEvent(this, decided, TransferRequestStatus.PENDING));

        log.info("Decided transfer request: id={}, status={}", id, target);
        return decided;
    }
}
