package se.bazaar_be.exception;

public class ProductUnavailableException extends BusinessLogicException {

    public ProductUnavailableException(String message) {
        super(ErrorCode.PRODUCT_UNAVAILABLE, message);
    }
}
