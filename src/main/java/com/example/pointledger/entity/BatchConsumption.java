package com.example.pointledger.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * BatchConsumption 實體（批次消費紀錄表）
 *
 * 功能：記錄一次 FIFO 消費從各批次扣除的點數
 * 用途：
 * 1. 審計追蹤：哪個業務操作消費了哪些批次
 * 2. 對帳支援：Σ 消費 + Σ 沒收 + Σ 剩餘 = Σ 發放
 *
 * 與觸發消費的操作在同一個事務中寫入。
 */
@Entity
@Table(name = "batch_consumptions", indexes = {
        @Index(name = "idx_reference", columnList = "reference_type, reference_id"),
        @Index(name = "idx_batch_id", columnList = "batch_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchConsumption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false)
    private Long batchId;

    @Column(name = "user_id", nullable = false, length = 50)
    private String userId;

    /**
     * 自該批次扣除的點數（> 0）
     */
    @Column(nullable = false)
    private Long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "reference_type", nullable = false, length = 30)
    private ConsumptionReferenceType referenceType;

    @Column(name = "reference_id", nullable = false, length = 100)
    private String referenceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
