package com.example.pointledger.facade.dto;

import com.example.pointledger.validation.NotSelfTransfer;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create Transfer Request DTO
 *
 * 用於接收建立轉帳請求的參數（冪等 key 由 Idempotency-Key header 提供）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@NotSelfTransfer
public class CreateTransferRequestRequest {

    /**
     * 付款方使用者 ID
     * 要求：非空，3-50 字元
     */
    @NotBlank(message = "FromUserId cannot be null or blank")
    @Size(min = 3, max = 50, message = "FromUserId length must be between 3 and 50 characters")
    private String fromUserId;

    /**
     * 收款方使用者 ID
     * 要求：非空，3-50 字元
     */
    @NotBlank(message = "ToUserId cannot be null or blank")
    @Size(min = 3, max = 50, message = "ToUserId length must be between 3 and 50 characters")
    private String toUserId;

    /**
     * 轉帳點數
     * 要求：非空，必須 > 0
     */
    @NotNull(message = "Amount cannot be null")
    @Positive(message = "Amount must be greater than 0")
    private Long amount;

    @Size(max = 255, message = "Message length must be <= 255 characters")
    private String message;
}
