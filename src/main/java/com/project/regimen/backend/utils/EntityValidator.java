package com.project.regimen.backend.utils;

import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.ValidationFailureException;
import org.springframework.stereotype.Component;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindingResult;
import org.springframework.validation.Validator;
import org.springframework.validation.beanvalidation.SpringValidatorAdapter;

/**
 * Runs Bean Validation on request bodies and fails with
 * {@link ValidationFailureException} carrying the field errors.
 */
@Component
public class EntityValidator {
    private final Validator validator;
    EntityValidator(jakarta.validation.Validator validator) {
        this.validator = new SpringValidatorAdapter(validator);
    }

    public void validate(Object object){
        BindingResult bindingResult = new BeanPropertyBindingResult(object, "object");
        validator.validate(object, bindingResult);
        if(bindingResult.hasErrors()) {
            throw new ValidationFailureException(ExceptionMessage.VALIDATION_FAILED, bindingResult);
        }
    }
}
