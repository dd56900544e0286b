package se.bazaar_be.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class ValidationFailedException extends BusinessLogicException {

    private final Map<String, String> fieldErrors;

    public ValidationFailedException(String field, String message) {
        this(Map.of(field, message));
    }

    public ValidationFailedException(Map<String, String> fieldErrors) {
        super(ErrorCode.VALIDATION_FAILED, "Validation failed: " + fieldErrors);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }
}
