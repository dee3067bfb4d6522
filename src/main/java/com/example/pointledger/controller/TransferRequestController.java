package com.example.pointledger.controller;

import com.example.pointledger.facade.TransferRequestFacade;
import com.example.pointledger.facade.dto.CreateTransferRequestRequest;
import com.example.pointledger.facade.dto.CreateTransferRequestResponse;
import com.example.pointledger.facade.dto.PendingCountResponse;
import com.example.pointledger.facade.dto.TransferRequestDto;
import com.example.pointledger.facade.dto.TransferRequestPageResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 轉帳請求 API
 *
 * 操作者身分由 X-User-Id header 提供（驗證由上游閘道負責）
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/transfer-requests")
@RequiredArgsConstructor
public class TransferRequestController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String USER_ID_HEADER = "X-User-Id";

    private final TransferRequestFacade transferRequestFacade;

    /**
     * 新建回 201，重送回 200 並帶回既有請求
     */
    @PostMapping
    public ResponseEntity<CreateTransferRequestResponse> createTransferRequest(
            @RequestHeader(IDEMPOTENCY_KEY_HEADER)
            @NotBlank(message = "Idempotency-Key cannot be blank")
            @Size(max = 100, message = "Idempotency-Key length must be <= 100 characters")
            String idempotencyKey,
            @Valid @RequestBody CreateTransferRequestRequest request) {
        log.info("POST /transfer-requests - fromUserId={}, toUserId={}, amount={}, key={}",
                request.getFromUserId(), request.getToUserId(), request.getAmount(), idempotencyKey);

        CreateTransferRequestResponse response = transferRequestFacade.createTransferRequest(request, idempotencyKey);

        HttpStatus status = response.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<TransferRequestDto> approve(
            @PathVariable @Positive(message = "Id must be positive") Long id,
            @RequestHeader(USER_ID_HEADER) @NotBlank(message = "X-User-Id cannot be blank") String actor) {
        log.info("POST /transfer-requests/{}/approve - actor={}", id, actor);

        return ResponseEntity.ok(transferRequestFacade.approveTransferRequest(id, actor));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<TransferRequestDto> reject(
            @PathVariable @Positive(message = "Id must be positive") Long id,
            @RequestHeader(USER_ID_HEADER) @NotBlank(message = "X-User-Id cannot be blank") String actor) {
        log.info("POST /transfer-requests/{}/reject - actor={}", id, actor);

        return ResponseEntity.ok(transferRequestFacade.rejectTransferRequest(id, actor));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TransferRequestDto> cancel(
            @PathVariable @Positive(message = "Id must be positive") Long id,
            @RequestHeader(USER_ID_HEADER) @NotBlank(message = "X-User-Id cannot be blank") String actor) {
        log.info("POST /transfer-requests/{}/cancel - actor={}", id, actor);

        return ResponseEntity.ok(transferRequestFacade.cancelTransferRequest(id, actor));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferRequestDto> getTransferRequest(
            @PathVariable @Positive(message = "Id must be positive") Long id,
            @RequestHeader(USER_ID_HEADER) @NotBlank(message = "X-User-Id cannot be blank") String viewer) {
        log.info("GET /transfer-requests/{} - viewer={}", id, viewer);

        return ResponseEntity.ok(transferRequestFacade.getTransferRequest(id, viewer));
    }

    @GetMapping("/pending")
    public ResponseEntity<TransferRequestPageResponse> getPending(
            @RequestHeader(USER_ID_HEADER) @NotBlank(message = "X-User-Id cannot be blank") String userId,
            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Page number must be >= 0")
            int page,
            @RequestParam(defaultValue = "20")
            @Min(value = 1, message = "Page size must be >= 1")
            @Max(value = 100, message = "Page size must be <= 100")
            int size) {
        log.info("GET /transfer-requests/pending?page={}&size={} - userId={}", page, size, userId);

        return ResponseEntity.ok(transferRequestFacade.getPendingTransferRequests(userId, page, size));
    }

    @GetMapping("/sent")
    public ResponseEntity<TransferRequestPageResponse> getSent(
            @RequestHeader(USER_ID_HEADER) @NotBlank(message = "X-User-Id cannot be blank") String userId,
            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Page number must be >= 0")
            int page,
            @RequestParam(defaultValue = "20")
            @Min(value = 1, message = "Page size must be >= 1")
            @Max(value = 100, message = "Page size must be <= 100")
            int size) {
        log.info("GET /transfer-requests/sent?page={}&size={} - userId={}", page, size, userId);

        return ResponseEntity.ok(transferRequestFacade.getSentTransferRequests(userId, page, size));
    }

    @GetMapping("/pending/count")
    public ResponseEntity<PendingCountResponse> getPendingCount(
            @RequestHeader(USER_ID_HEADER) @NotBlank(message = "X-User-Id cannot be blank") String userId) {
        log.info("GET /transfer-requests/pending/count - userId={}", userId);

        return ResponseEntity.ok(transferRequestFacade.getPendingTransferRequestCount(userId));
    }
}
