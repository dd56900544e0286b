package se.bazaar_be.exception;

import lombok.Getter;

/**
 * Base type for every failure the marketplace core reports to its caller.
 * Each failure is scoped to a single operation and carries the code the HTTP layer maps to a status.
 */
@Getter
public class BusinessLogicException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessLogicException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessLogicException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
