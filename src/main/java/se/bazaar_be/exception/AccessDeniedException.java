package se.bazaar_be.exception;

public class AccessDeniedException extends BusinessLogicException {

    public AccessDeniedException(String message) {
        super(ErrorCode.ACCESS_DENIED, message);
    }
}
