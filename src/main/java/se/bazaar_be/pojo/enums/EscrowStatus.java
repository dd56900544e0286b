package se.bazaar_be.pojo.enums;

import java.util.EnumSet;
import java.util.Set;

public enum EscrowStatus {
    // Order placed, payment not yet confirmed
    PENDING,

    // Payment captured and held by the platform
    HELD,

    // Funds paid out to the seller
    RELEASED_TO_SELLER,

    // Funds returned to the buyer
    REFUNDED_TO_CUSTOMER;

    public boolean isTerminal() {
        return this == RELEASED_TO_SELLER || this == REFUNDED_TO_CUSTOMER;
    }

    public Set<EscrowStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(HELD);
            case HELD -> EnumSet.of(RELEASED_TO_SELLER, REFUNDED_TO_CUSTOMER);
            case RELEASED_TO_SELLER, REFUNDED_TO_CUSTOMER -> EnumSet.noneOf(EscrowStatus.class);
        };
    }

    public boolean canTransitionTo(EscrowStatus target) {
        return allowedTransitions().contains(target);
    }
}
