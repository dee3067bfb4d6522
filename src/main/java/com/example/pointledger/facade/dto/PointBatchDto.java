package com.example.pointledger.facade.dto;

import com.example.pointledger.entity.PointBatchSource;
import com.example.pointledger.entity.PointBatchStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointBatchDto {
    private Long id;
    private String userId;
    private Long originalAmount;
    private Long remainingAmount;
    private Long forfeitedAmount;
    private PointBatchSource sourceType;
    private String sourceReference;
    private PointBatchStatus status;
    private LocalDateTime issuedAt;
    private LocalDateTime expiresAt;
}
