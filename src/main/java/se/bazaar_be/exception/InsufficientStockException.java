package se.bazaar_be.exception;

import lombok.Getter;

@Getter
public class InsufficientStockException extends BusinessLogicException {

    private final Long productId;

    public InsufficientStockException(Long productId, String message) {
        super(ErrorCode.INSUFFICIENT_STOCK, message);
        this.productId = productId;
    }
}
