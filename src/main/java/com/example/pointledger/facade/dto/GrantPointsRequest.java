package com.example.pointledger.facade.dto;

import com.example.pointledger.entity.PointBatchSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Grant Points Request DTO
 *
 * 用於接收發放點數的請求參數
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrantPointsRequest {

    /**
     * 收到點數的使用者 ID
     * 要求：非空，3-50 字元
     */
    @NotBlank(message = "UserId cannot be null or blank")
    @Size(min = 3, max = 50, message = "UserId length must be between 3 and 50 characters")
    private String userId;

    /**
     * 發放點數
     * 要求：非空，必須 > 0
     */
    @NotNull(message = "Amount cannot be null")
    @Positive(message = "Amount must be greater than 0")
    private Long amount;

    /**
     * 過期時間（可選，必須晚於目前時間；未提供時套用 ledger.grant.default-validity，未設定則永不過期）
     */
    private LocalDateTime expiresAt;

    /**
     * 來源類型（可選，預設 ADMIN_GRANT；TRANSFER 只能由核准轉帳產生）
     */
    private PointBatchSource sourceType;

    @Size(max = 100, message = "SourceReference length must be <= 100 characters")
    private String sourceReference;
}
