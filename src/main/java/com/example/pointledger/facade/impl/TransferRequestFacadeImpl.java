package com.example.pointledger.facade.impl;

import com.example.pointledger.config.LedgerProperties;
import com.example.pointledger.entity.TransferRequest;
import com.example.pointledger.exception.ConflictingIdempotencyKeyException;
import com.example.pointledger.exception.InsufficientBalanceException;
import com.example.pointledger.exception.InvalidTransferRequestStateException;
import com.example.pointledger.exception.TransferRequestAlreadyDecidedException;
import com.example.pointledger.exception.TransferRequestNotFoundException;
import com.example.pointledger.exception.UnauthorizedTransferActionException;
import com.example.pointledger.facade.TransferRequestFacade;
import com.example.pointledger.facade.dto.*;
import com.example.pointledger.service.TransferRequestService;
import com.example.pointledger.service.model.Registration;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * TransferRequestFacade 實作
 *
 * 協調邏輯：
 * - 委派給 TransferRequestService 進行狀態轉換
 * - 依賴事件驅動架構處理後續通知
 * - 業務異常記錄後重新拋出，由 GlobalExceptionHandler 轉換為 HTTP 回應
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferRequestFacadeImpl implements TransferRequestFacade {

    private final TransferRequestService transferRequestService;
    private final LedgerProperties ledgerProperties;

    @Override
    @Retry(name = "ledgerStorage")
    public CreateTransferRequestResponse createTransferRequest(CreateTransferRequestRequest request, String idempotencyKey) {
        try {
            log.info("Processing create transfer request: fromUserId={}, toUserId={}, amount={}, key={}",
                    request.getFromUserId(), request.getToUserId(), request.getAmount(), idempotencyKey);

            // 1. 清理參數（基本驗證已在 controller 層完成）
            String fromUserId = request.getFromUserId().trim();
            String toUserId = request.getToUserId().trim();

            // 2. 委派給服務層（冪等登記、餘額檢查、建立 PENDING）
            Registration registration = transferRequestService.create(
                    fromUserId, toUserId, request.getAmount(), idempotencyKey.trim(),
                    ledgerProperties.getTransferRequest().getDefaultTtl(), request.getMessage());

            // 3. 轉換為 DTO
            return CreateTransferRequestResponse.builder()
                    .transferRequest(toDto(registration.getRequest()))
                    .replayed(registration.isReplayed())
                    .build();
        } catch (ConflictingIdempotencyKeyException e) {
            log.error("Idempotency key conflict when creating transfer request: fromUserId={}, key={}",
                    request.getFromUserId(), idempotencyKey, e);
            throw e;
        } catch (InsufficientBalanceException e) {
            log.error("Insufficient points when creating transfer request: fromUserId={}, amount={}, available={}",
                    request.getFromUserId(), request.getAmount(), e.getAvailable(), e);
            throw e;
        } catch (IllegalArgumentException e) {
            log.error("Invalid request parameters: {}", e.getMessage(), e);
            throw e;
        }
    }

    @Override
    @Retry(name = "ledgerStorage")
    public TransferRequestDto approveTransferRequest(Long id, String actor) {
        try {
            log.info("Processing approve transfer request: id={}, actor={}", id, actor);
            return toDto(transferRequestService.approve(id, actor.trim()));
        } catch (InsufficientBalanceException e) {
            log.error("Insufficient points when approving transfer request: id={}, fromUserId={}, available={}, required={}",
                    id, e.getUserId(), e.getAvailable(), e.getRequired(), e);
            throw e;
        } catch (TransferRequestNotFoundException | UnauthorizedTransferActionException
                 | InvalidTransferRequestStateException | TransferRequestAlreadyDecidedException e) {
            log.error("Failed to approve transfer request: id={}, actor={}", id, actor, e);
            throw e;
        }
    }

    @Override
    @Retry(name = "ledgerStorage")
    public TransferRequestDto rejectTransferRequest(Long id, String actor) {
        try {
            log.info("Processing reject transfer request: id={}, actor={}", id, actor);
            return toDto(transferRequestService.reject(id, actor.trim()));
        } catch (TransferRequestNotFoundException | UnauthorizedTransferActionException
                 | InvalidTransferRequestStateException | TransferRequestAlreadyDecidedException e) {
            log.error("Failed to reject transfer request: id={}, actor={}", id, actor, e);
            throw e;
        }
    }

    @Override
    @Retry(name = "ledgerStorage")
    public TransferRequestDto cancelTransferRequest(Long id, String actor) {
        try {
            log.info("Processing cancel transfer request: id={}, actor={}", id, actor);
            return toDto(transferRequestService.cancel(id, actor.trim()));
        } catch (TransferRequestNotFoundException | UnauthorizedTransferActionException
                 | InvalidTransferRequestStateException | TransferRequestAlreadyDecidedException e) {
            log.error("Failed to cancel transfer request: id={}, actor={}", id, actor, e);
            throw e;
        }
    }

    @Override
    @Retry(name = "ledgerStorage")
    public TransferRequestDto getTransferRequest(Long id, String viewer) {
        return toDto(transferRequestService.findById(id, viewer.trim()));
    }

    @Override
    @Retry(name = "ledgerStorage")
    public TransferRequestPageResponse getPendingTransferRequests(String toUserId, int page, int size) {
        String cleanUserId = toUserId.trim();
        Page<TransferRequest> requestPage = transferRequestService.findPendingForRecipient(cleanUserId, page, size);
        log.info("Pending transfer requests retrieved: userId={}, recordCount={}, totalElements={}",
                cleanUserId, requestPage.getNumberOfElements(), requestPage.getTotalElements());
        return toPageResponse(requestPage);
    }

    @Override
    @Retry(name = "ledgerStorage")
    public TransferRequestPageResponse getSentTransferRequests(String fromUserId, int page, int size) {
        String cleanUserId = fromUserId.trim();
        Page<TransferRequest> requestPage = transferRequestService.findSentBy(cleanUserId, page, size);
        log.info("Sent transfer requests retrieved: userId={}, recordCount={}, totalElements={}",
                cleanUserId, requestPage.getNumberOfElements(), requestPage.getTotalElements());
        return toPageResponse(requestPage);
    }

    @Override
    @Retry(name = "ledgerStorage")
    public PendingCountResponse getPendingTransferRequestCount(String toUserId) {
        String cleanUserId = toUserId.trim();
        return PendingCountResponse.builder()
                .userId(cleanUserId)
                .pendingCount(transferRequestService.countPendingForRecipient(cleanUserId))
                .build();
    }

    private TransferRequestPageResponse toPageResponse(Page<TransferRequest> requestPage) {
        List<TransferRequestDto> requests = requestPage.getContent().stream()
                .map(this::toDto)
                .toList();

        return TransferRequestPageResponse.builder()
                .transferRequests(requests)
                .pagination(PaginationMeta.of(requestPage))
                .build();
    }

    /**
     * 將 TransferRequest 實體轉換為 TransferRequestDto
     */
    private TransferRequestDto toDto(TransferRequest request) {
        return TransferRequestDto.builder()
                .id(request.getId())
                .fromUserId(request.getFromUserId())
                .toUserId(request.getToUserId())
                .amount(request.getAmount())
                .message(request.getMessage())
                .status(request.getStatus())
                .createdAt(request.getCreatedAt())
                .expiresAt(request.getExpiresAt())
                .decidedAt(request.getDecidedAt())
                .creditedBatchId(request.getCreditedBatchId())
                .build();
    }
}
