package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.GatewayRefundRequest;
import se.bazaar_be.dto.request.PaymentConfirmationRequest;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.exception.ValidationFailedException;
import se.bazaar_be.mapper.OrderMapper;
import se.bazaar_be.pojo.Order;
import se.bazaar_be.pojo.OrderItem;
import se.bazaar_be.pojo.enums.NoteAuthorType;
import se.bazaar_be.pojo.enums.OrderStatus;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Intake for signals from the payment gateway. The gateway integration itself lives outside this
 * service and forwards its callbacks here under an admin identity.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class PaymentService {

    private final OrderPersistenceService orderPersistence;
    private final OrderAccessPolicy accessPolicy;
    private final InventoryService inventoryService;
    private final OrderMapper orderMapper;
    private final Clock clock;

    @Transactional
    public OrderDetailResponse confirmPayment(Long orderId, PaymentConfirmationRequest request, Actor actor) {
        accessPolicy.requireAdmin(actor);
        Order order = orderPersistence.load(orderId);
        requirePendingPayment(order);

        LocalDateTime now = LocalDateTime.now(clock);
        order.confirmPayment(request.getTransactionId(), now);
        order.addNote(NoteAuthorType.SYSTEM, "Payment confirmed, transaction " + request.getTransactionId(),
                Actor.SYSTEM.label(), now);
        order = orderPersistence.commitEscrowTransition(order);

        log.info("Payment confirmed for order {} (transaction {}), escrow held", order.getOrderNumber(), request.getTransactionId());
        return orderMapper.convertToDetailResponse(order);
    }

    @Transactional
    public OrderDetailResponse failPayment(Long orderId, PaymentConfirmationRequest request, Actor actor) {
        accessPolicy.requireAdmin(actor);
        Order order = orderPersistence.load(orderId);
        requirePendingPayment(order);

        LocalDateTime now = LocalDateTime.now(clock);
        order.recordPaymentFailure(request.getTransactionId());
        String reason = request.getReason() == null || request.getReason().isBlank() ? "unknown reason" : request.getReason();
        order.addNote(NoteAuthorType.SYSTEM, "Payment failed: " + reason, Actor.SYSTEM.label(), now);
        order = orderPersistence.commitStatusChange(order);

        log.warn("Payment failed for order {}: {}", order.getOrderNumber(), reason);
        return orderMapper.convertToDetailResponse(order);
    }

    @Transactional
    public OrderDetailResponse recordGatewayRefund(Long orderId, GatewayRefundRequest request, Actor actor) {
        accessPolicy.requireAdmin(actor);
        Order order = orderPersistence.load(orderId);
        if (request.getAmount().compareTo(order.getTotal()) > 0) {
            throw new ValidationFailedException("amount", "Refund amount cannot exceed the order total of " + order.getTotal());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        boolean returnsStock = order.getStatus().isPreDelivery();
        if (order.hasActiveDispute()) {
            String message = "Dispute closed by gateway refund " + request.getRefundId();
            order.closeDispute(message, Actor.SYSTEM.label(), now);
            order.addNote(NoteAuthorType.SYSTEM, message, Actor.SYSTEM.label(), now);
            log.info("Active dispute on order {} closed by gateway refund {}", order.getOrderNumber(), request.getRefundId());
        }
        order.recordGatewayRefund(request.getRefundId(), request.getAmount(), now);
        order.addNote(NoteAuthorType.SYSTEM, "Refund " + request.getRefundId() + " of " + request.getAmount()
                + " processed by payment gateway", Actor.SYSTEM.label(), now);
        order = orderPersistence.commitEscrowTransition(order);

        if (returnsStock && order.getStatus() == OrderStatus.REFUNDED) {
            for (OrderItem item : order.getItems()) {
                inventoryService.release(item.getProductId(), item.getQuantity());
            }
        }

        log.info("Gateway refund {} recorded for order {}, escrow {}", request.getRefundId(), order.getOrderNumber(),
                order.getEscrow().getStatus());
        return orderMapper.convertToDetailResponse(order);
    }

    private void requirePendingPayment(Order order) {
        if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
            throw new InvalidStatusException("Order " + order.getOrderNumber()
                    + " is not awaiting payment, current status: " + order.getStatus());
        }
    }
}
