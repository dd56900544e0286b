package se.bazaar_be.exception;

public class RefundNotAllowedException extends BusinessLogicException {

    public RefundNotAllowedException(String message) {
        super(ErrorCode.REFUND_NOT_ALLOWED, message);
    }

    public RefundNotAllowedException(String message, Throwable cause) {
        super(ErrorCode.REFUND_NOT_ALLOWED, message, cause);
    }
}
