package com.example.pointledger.facade.dto;

import com.example.pointledger.entity.TransferRequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequestDto {
    private Long id;
    private String fromUserId;
    private String toUserId;
    private Long amount;
    private String message;
    private TransferRequestStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
    private LocalDateTime decidedAt;

    /**
     * 核准後收款方獲得的批次 ID
     */
    private Long creditedBatchId;
}
