package com.taskpulse.checkin.core.engine.validation;

import com.taskpulse.checkin.core.exception.CheckInValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bean Validation front door for API payloads. Violations become a
 * {@link CheckInValidationException} keyed by the snake_case wire name of each field.
 */
@Slf4j
public class CheckInRequestValidator {

    private final Validator validator;

    public CheckInRequestValidator(ValidatorFactory validatorFactory) {
        this.validator = validatorFactory.getValidator();
    }

    public static CheckInRequestValidator create() {
        return new CheckInRequestValidator(Validation.buildDefaultValidatorFactory());
    }

    public <T> Mono<T> validate(T request) {
        if (request == null) {
            return Mono.error(new CheckInValidationException("body", "is required"));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return Mono.just(request);
        }
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .forEach(violation -> fieldErrors.merge(
                        toWireName(violation.getPropertyPath().toString()),
                        violation.getMessage(),
                        (first, second) -> first + ", " + second));
        log.debug("Rejected {}: {}", request.getClass().getSimpleName(), fieldErrors);
        return Mono.error(new CheckInValidationException(fieldErrors));
    }

    static String toWireName(String propertyPath) {
        StringBuilder sb = new StringBuilder(propertyPath.length() + 4);
        for (char c : propertyPath.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('_').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
