package com.example.pointledger.service.impl;

import com.example.pointledger.entity.TransferRequestStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 轉帳請求狀態轉換規則管理器
 *
 * 狀態轉換規則：
 * PENDING → APPROVED, REJECTED, CANCELLED, EXPIRED
 * 終態（APPROVED, REJECTED, CANCELLED, EXPIRED）→ 不允許轉換
 *
 * 實際的轉換由資料庫 compare-and-set 執行，此處只負責事前檢查與錯誤訊息。
 */
public final class TransferRequestStateTransitionValidator {

    /**
     * Key: 當前狀態
     * Value: 允許轉換到的狀態集合
     */
    private static final Map<TransferRequestStatus, Set<TransferRequestStatus>> ALLOWED_TRANSITIONS;

    static {
        ALLOWED_TRANSITIONS = new EnumMap<>(TransferRequestStatus.class);

        ALLOWED_TRANSITIONS.put(TransferRequestStatus.PENDING, EnumSet.of(
            TransferRequestStatus.APPROVED,
            TransferRequestStatus.REJECTED,
            TransferRequestStatus.CANCELLED,
            TransferRequestStatus.EXPIRED));

        // 終態不允許轉換
        ALLOWED_TRANSITIONS.put(TransferRequestStatus.APPROVED, EnumSet.noneOf(TransferRequestStatus.class));
        ALLOWED_TRANSITIONS.put(TransferRequestStatus.REJECTED, EnumSet.noneOf(TransferRequestStatus.class));
        ALLOWED_TRANSITIONS.put(TransferRequestStatus.CANCELLED, EnumSet.noneOf(TransferRequestStatus.class));
        ALLOWED_TRANSITIONS.put(TransferRequestStatus.EXPIRED, EnumSet.noneOf(TransferRequestStatus.class));
    }

    private TransferRequestStateTransitionValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 驗證狀態轉換是否合法
     *
     * @param currentStatus 當前狀態
     * @param targetStatus  目標狀態
     * @return true if transition is allowed, false otherwise
     */
    public static boolean isTransitionAllowed(TransferRequestStatus currentStatus, TransferRequestStatus targetStatus) {
        if (currentStatus == null || targetStatus == null) {
            return false;
        }
        Set<TransferRequestStatus> allowedTargets = ALLOWED_TRANSITIONS.get(currentStatus);
        return allowedTargets != null && allowedTargets.contains(targetStatus);
    }

    public static boolean isTerminalState(TransferRequestStatus status) {
        if (status == null) {
            return false;
        }
        return ALLOWED_TRANSITIONS.get(status).isEmpty();
    }
}
