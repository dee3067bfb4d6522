package com.example.pointledger.service.impl;

import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.exception.ConflictingIdempotencyKeyException;
import com.example.pointledger.repository.TransferRequestRepository;
import com.example.pointledger.service.IdempotencyRegistry;
import com.example.pointledger.service.model.Registration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * IdempotencyRegistry 實作類別
 *
 * 實作重點：
 * 1. 讀取與插入都在獨立的新事務（REQUIRES_NEW）中執行
 *    - 插入失敗不會把呼叫端事務標記為 rollback-only
 *    - 重新讀取能看到剛提交的勝出者，不受呼叫端事務快照影響
 * 2. 唯一約束衝突（DataIntegrityViolationException）後重新讀取並比對指紋
 */
@Slf4j
@Component
public class IdempotencyRegistryImpl implements IdempotencyRegistry {

    private final TransferRequestRepository transferRequestRepository;
    private final TransactionTemplate requiresNew;

    public IdempotencyRegistryImpl(TransferRequestRepository transferRequestRepository,
                                   PlatformTransactionManager transactionManager) {
        this.transferRequestRepository = transferRequestRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 計算請求內容指紋
     *
     * @return 32 字元 hex
     */
    public static String fingerprint(String toUserId, long amount, String message) {
        String payload = toUserId + "|" + amount + "|" + (message == null ? "" : message);
        return DigestUtils.md5DigestAsHex(payload.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Registration register(String fromUserId, String idempotencyKey, String fingerprint,
                                 Supplier<TransferRequest> newRequest) {
        // 1. 既有紀錄：重送或衝突
        Optional<TransferRequest> existing = findExisting(fromUserId, idempotencyKey);
        if (existing.isPresent()) {
            return resolve(existing.get(), fingerprint);
        }

        // 2. 插入新請求
        TransferRequest candidate = newRequest.get();
        try {
            TransferRequest saved = requiresNew.execute(status -> transferRequestRepository.saveAndFlush(candidate));
            return Registration.created(saved);
        } catch (DataIntegrityViolationException e) {
            // 3. 並發插入落敗：讀取勝出者
            log.info("Idempotency key race lost, re-reading winner: fromUserId={}, key={}", fromUserId, idempotencyKey);
            TransferRequest winner = findExisting(fromUserId, idempotencyKey).orElseThrow(() -> e);
            return resolve(winner, fingerprint);
        }
    }

    private Optional<TransferRequest> findExisting(String fromUserId, String idempotencyKey) {
        return requiresNew.execute(status ->
            transferRequestRepository.findByFromUserIdAndIdempotencyKey(fromUserId, idempotencyKey));
    }

    private Registration resolve(TransferRequest existing, String fingerprint) {
        if (!existing.getPayloadFingerprint().equals(fingerprint)) {
            log.warn("Idempotency key reused with a different payload: fromUserId={}, key={}, existingId={}",
                existing.getFromUserId(), existing.getIdempotencyKey(), existing.getId());
            throw new ConflictingIdempotencyKeyException(
                existing.getFromUserId(), existing.getIdempotencyKey(), existing.getId());
        }
        log.info("Replayed transfer request: id={}, fromUserId={}, key={}",
            existing.getId(), existing.getFromUserId(), existing.getIdempotencyKey());
        return Registration.replayed(existing);
    }
}
