package com.example.pointledger.facade.impl;

import com.example.pointledger.config.LedgerProperties;
import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.entity.PointBatchSource;
import com.example.pointledger.exception.InvalidAmountException;
import com.example.pointledger.facade.PointFacade;
import com.example.pointledger.facade.dto.GetBalanceResponse;
import com.example.pointledger.facade.dto.GrantPointsRequest;
import com.example.pointledger.facade.dto.PointBatchDto;
import com.example.pointledger.facade.dto.UpcomingExpirationsResponse;
import com.example.pointledger.service.PointBatchService;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * PointFacade 實作
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PointFacadeImpl implements PointFacade {

    private final PointBatchService pointBatchService;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    @Override
    @Retry(name = "ledgerStorage")
    public PointBatchDto grantPoints(GrantPointsRequest request) {
        // TRANSFER 批次必須有對應的消費紀錄，只能由核准轉帳產生
        if (request.getSourceType() == PointBatchSource.TRANSFER) {
            log.warn("Rejected grant with TRANSFER source: userId={}", request.getUserId());
            throw new IllegalArgumentException("Source type TRANSFER is reserved for approved transfer requests");
        }
        if (request.getExpiresAt() != null && !request.getExpiresAt().isAfter(LocalDateTime.now(clock))) {
            log.warn("Rejected grant already expired: userId={}, expiresAt={}", request.getUserId(), request.getExpiresAt());
            throw new IllegalArgumentException("Expiry must be in the future: " + request.getExpiresAt());
        }

        try {
            log.info("Processing grant points request: userId={}, amount={}, source={}",
                    request.getUserId(), request.getAmount(), request.getSourceType());

            String userId = request.getUserId().trim();
            PointBatchSource sourceType = request.getSourceType() != null
                    ? request.getSourceType()
                    : PointBatchSource.ADMIN_GRANT;

            PointBatch batch = pointBatchService.createBatch(
                    userId, request.getAmount(), resolveExpiresAt(request.getExpiresAt()),
                    sourceType, request.getSourceReference());

            return toDto(batch);
        } catch (InvalidAmountException e) {
            log.error("Invalid grant amount: userId={}, amount={}", request.getUserId(), request.getAmount(), e);
            throw e;
        }
    }

    @Override
    @Retry(name = "ledgerStorage")
    public GetBalanceResponse getBalance(String userId) {
        String cleanUserId = userId.trim();
        Long balance = pointBatchService.getBalance(cleanUserId);
        log.debug("Balance retrieved: userId={}, balance={}", cleanUserId, balance);
        return GetBalanceResponse.builder()
                .userId(cleanUserId)
                .balance(balance)
                .build();
    }

    @Override
    @Retry(name = "ledgerStorage")
    public UpcomingExpirationsResponse getUpcomingExpirations(String userId) {
        String cleanUserId = userId.trim();
        List<PointBatchDto> batches = pointBatchService.findUpcomingExpirations(cleanUserId).stream()
                .map(PointFacadeImpl::toDto)
                .toList();
        long totalExpiring = batches.stream().mapToLong(PointBatchDto::getRemainingAmount).sum();

        return UpcomingExpirationsResponse.builder()
                .userId(cleanUserId)
                .totalExpiring(totalExpiring)
                .batches(batches)
                .build();
    }

    private LocalDateTime resolveExpiresAt(LocalDateTime requested) {
        if (requested != null) {
            return requested;
        }
        if (ledgerProperties.getGrant().getDefaultValidity() == null) {
            return null;
        }
        return LocalDateTime.now(clock).plus(ledgerProperties.getGrant().getDefaultValidity());
    }

    static PointBatchDto toDto(PointBatch batch) {
        return PointBatchDto.builder()
                .id(batch.getId())
                .userId(batch.getUserId())
                .originalAmount(batch.getOriginalAmount())
                .remainingAmount(batch.getRemainingAmount())
                .forfeitedAmount(batch.getForfeitedAmount())
                .sourceType(batch.getSourceType())
                .sourceReference(batch.getSourceReference())
                .status(batch.getStatus())
                .issuedAt(batch.getIssuedAt())
                .expiresAt(batch.getExpiresAt())
                .build();
    }
}
