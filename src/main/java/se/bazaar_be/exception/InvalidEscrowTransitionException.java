package se.bazaar_be.exception;

import lombok.Getter;
import se.bazaar_be.pojo.enums.EscrowStatus;

@Getter
public class InvalidEscrowTransitionException extends BusinessLogicException {

    private final EscrowStatus from;
    private final EscrowStatus to;

    public InvalidEscrowTransitionException(EscrowStatus from, EscrowStatus to) {
        super(ErrorCode.INVALID_ESCROW_TRANSITION,
                "Escrow cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public InvalidEscrowTransitionException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ESCROW_TRANSITION, message, cause);
        this.from = null;
        this.to = null;
    }
}
