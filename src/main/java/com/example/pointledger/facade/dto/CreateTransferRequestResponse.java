package com.example.pointledger.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 建立轉帳請求的結果
 *
 * replayed = true 表示相同 Idempotency-Key 的重送，回傳的是既有請求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransferRequestResponse {
    private TransferRequestDto transferRequest;
    private boolean replayed;
}
