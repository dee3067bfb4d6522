package com.example.pointledger.service.impl;

import com.example.pointledger.entity.PointBatch;
import com.example.pointledger.exception.InsufficientBalanceException;
import com.example.pointledger.service.model.ConsumptionRecord;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * FIFO 消費規劃器
 *
 * 規則：
 * - 只有 ACTIVE、剩餘 > 0 且 expiresAt 晚於 now 的批次可被消費
 * - 排序：expiresAt 升序（永不過期排最後），再依 issuedAt 升序，再依 id 升序
 * - 可用總和不足時拋出 InsufficientBalanceException，不產生任何計畫
 *
 * 純函式，不修改傳入的批次。
 */
public final class FifoConsumptionPlanner {

    static final Comparator<PointBatch> FIFO_ORDER = Comparator
        .comparing(PointBatch::getExpiresAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(PointBatch::getIssuedAt)
        .thenComparing(PointBatch::getId);

    private FifoConsumptionPlanner() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 依 FIFO 順序規劃消費
     *
     * @param userId  付款方（僅用於錯誤訊息）
     * @param batches 使用者的批次（通常已鎖定）
     * @param amount  要消費的點數
     * @param now     目前時間
     * @return 消費計畫，依扣除順序
     * @throws InsufficientBalanceException 可用點數不足
     */
    public static List<ConsumptionRecord> plan(String userId, List<PointBatch> batches, long amount, LocalDateTime now) {
        List<PointBatch> eligible = batches.stream()
            .filter(PointBatch::isActive)
            .filter(batch -> batch.getRemainingAmount() > 0)
            .filter(batch -> !batch.isExpiredAt(now))
            .sorted(FIFO_ORDER)
            .collect(Collectors.toList());

        long available = eligible.stream().mapToLong(PointBatch::getRemainingAmount).sum();
        if (available < amount) {
            throw new InsufficientBalanceException(userId, available, amount);
        }

        List<ConsumptionRecord> plan = new ArrayList<>();
        long outstanding = amount;
        for (PointBatch batch : eligible) {
            if (outstanding == 0) {
                break;
            }
            long taken = Math.min(outstanding, batch.getRemainingAmount());
            plan.add(ConsumptionRecord.builder()
                .batchId(batch.getId())
                .amountTaken(taken)
                .sourceExpiresAt(batch.getExpiresAt())
                .build());
            outstanding -= taken;
        }
        return plan;
    }
}
