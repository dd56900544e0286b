package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.pojo.Order;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Time-dependent refund eligibility. Always evaluated against the injected clock, never cached.
 */
@Component
@RequiredArgsConstructor
public class RefundPolicy {

    public static final int REFUND_WINDOW_DAYS = 30;

    private static final Duration REFUND_WINDOW = Duration.ofDays(REFUND_WINDOW_DAYS);

    private final Clock clock;

    public boolean canRequestRefund(Order order) {
        LocalDateTime deliveredAt = order.getDeliveredAt();
        if (deliveredAt == null) {
            return false;
        }
        Duration sinceDelivery = Duration.between(deliveredAt, LocalDateTime.now(clock));
        return sinceDelivery.compareTo(REFUND_WINDOW) <= 0 && order.getEscrow().isHeld();
    }

    public OrderDetailResponse.ReturnWindow returnWindow(Order order) {
        LocalDateTime deliveredAt = order.getDeliveredAt();
        if (deliveredAt == null) {
            return null;
        }
        long daysSinceDelivery = Duration.between(deliveredAt, LocalDateTime.now(clock)).toDays();
        long remainingDays = Math.max(0, REFUND_WINDOW_DAYS - daysSinceDelivery);
        return OrderDetailResponse.ReturnWindow.builder()
                .totalDays(REFUND_WINDOW_DAYS)
                .remainingDays(remainingDays)
                .expired(remainingDays == 0)
                .build();
    }
}
