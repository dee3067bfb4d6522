package com.example.pointledger.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.BeanWrapperImpl;

public class NotSelfTransferValidator implements ConstraintValidator<NotSelfTransfer, Object> {

    private String fromProperty;
    private String toProperty;

    @Override
    public void initialize(NotSelfTransfer constraint) {
        this.fromProperty = constraint.from();
        this.toProperty = constraint.to();
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }

        BeanWrapper wrapper = new BeanWrapperImpl(value);
        Object from = wrapper.getPropertyValue(fromProperty);
        Object to = wrapper.getPropertyValue(toProperty);

        // null 交給 @NotBlank
        if (from == null || to == null) {
            return true;
        }

        if (!from.toString().trim().equals(to.toString().trim())) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                .addPropertyNode(toProperty)
                .addConstraintViolation();
        return false;
    }
}
