package com.example.pointledger.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * 類別層級驗證：付款方與收款方不可為同一使用者（比較前先 trim）
 *
 * 違規會掛在 {@link #to()} 指定的欄位上，錯誤訊息呈現為 "toUserId: ..."
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = NotSelfTransferValidator.class)
@Documented
public @interface NotSelfTransfer {

    String message() default "Cannot transfer to yourself";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};

    /** 付款方屬性名稱 */
    String from() default "fromUserId";

    /** 收款方屬性名稱 */
    String to() default "toUserId";
}
