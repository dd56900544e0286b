package se.bazaar_be.exception;

public class InvalidStatusException extends BusinessLogicException {

    public InvalidStatusException(String message) {
        super(ErrorCode.INVALID_STATUS, message);
    }

    public InvalidStatusException(String message, Throwable cause) {
        super(ErrorCode.INVALID_STATUS, message, cause);
    }
}
