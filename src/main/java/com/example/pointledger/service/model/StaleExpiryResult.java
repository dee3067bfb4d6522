package com.example.pointledger.service.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一頁過期請求清掃的結果
 *
 * candidates 為本頁查到的 PENDING 逾期請求數，expired 為 CAS 成功的筆數。
 * 兩者差額是清掃期間被拒絕或取消的請求。
 */
@Getter
@AllArgsConstructor
public class StaleExpiryResult {

    private final int candidates;

    private final int expired;
}
