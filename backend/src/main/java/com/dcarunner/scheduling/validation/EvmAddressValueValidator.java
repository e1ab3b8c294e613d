package com.dcarunner.scheduling.validation;

import com.dcarunner.common.EvmAddress;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class EvmAddressValueValidator implements ConstraintValidator<EvmAddressValue, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || EvmAddress.isValid(value);
    }
}
