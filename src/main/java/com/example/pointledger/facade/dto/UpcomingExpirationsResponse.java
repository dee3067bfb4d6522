package com.example.pointledger.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 即將過期點數（僅供顯示，不影響帳本）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpcomingExpirationsResponse {
    private String userId;

    /**
     * 區間內即將過期的點數總和
     */
    private Long totalExpiring;

    /**
     * 依 expiresAt 升序
     */
    private List<PointBatchDto> batches;
}
