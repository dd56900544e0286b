package se.bazaar_be.pojo.enums;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    // Order is created, awaiting payment.
    PENDING_PAYMENT,

    // Payment signal received, money is held in escrow.
    PAYMENT_CONFIRMED,

    // Seller is preparing the package.
    PROCESSING,

    // Handed to the carrier.
    SHIPPED,

    // Last-mile delivery. Kept for record compatibility with carrier updates.
    OUT_FOR_DELIVERY,

    // Seller confirmed the delivery, escrow countdown is running.
    DELIVERED,

    CANCELLED,

    REFUNDED;

    public boolean isPreDelivery() {
        return this == PENDING_PAYMENT || this == PAYMENT_CONFIRMED || this == PROCESSING
                || this == SHIPPED || this == OUT_FOR_DELIVERY;
    }

    public Set<OrderStatus> allowedTransitions() {
        return switch (this) {
            case PENDING_PAYMENT -> EnumSet.of(PAYMENT_CONFIRMED, CANCELLED, REFUNDED);
            case PAYMENT_CONFIRMED -> EnumSet.of(PROCESSING, CANCELLED, REFUNDED);
            case PROCESSING -> EnumSet.of(SHIPPED, CANCELLED, REFUNDED);
            case SHIPPED -> EnumSet.of(OUT_FOR_DELIVERY, DELIVERED, CANCELLED, REFUNDED);
            case OUT_FOR_DELIVERY -> EnumSet.of(DELIVERED, CANCELLED, REFUNDED);
            case DELIVERED, CANCELLED, REFUNDED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTransitions().contains(target);
    }
}
