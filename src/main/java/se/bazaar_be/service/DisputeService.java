package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.OpenDisputeRequest;
import se.bazaar_be.dto.request.ResolveDisputeRequest;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.dto.response.OrderListResponse;
import se.bazaar_be.dto.response.PagedResponse;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.exception.ResourceNotFoundException;
import se.bazaar_be.exception.ValidationFailedException;
import se.bazaar_be.mapper.OrderMapper;
import se.bazaar_be.pojo.Order;
import se.bazaar_be.pojo.OrderItem;
import se.bazaar_be.pojo.enums.DisputeStatus;
import se.bazaar_be.pojo.enums.NoteAuthorType;
import se.bazaar_be.pojo.enums.OrderStatus;
import se.bazaar_be.repository.OrderRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Buyer disputes and their admin resolution. An active dispute freezes auto-release; resolving it is
 * the only way an admin can force the escrow into a terminal state.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class DisputeService {

    private final OrderRepository orderRepository;
    private final OrderPersistenceService orderPersistence;
    private final OrderAccessPolicy accessPolicy;
    private final EscrowService escrowService;
    private final InventoryService inventoryService;
    private final OrderMapper orderMapper;
    private final Clock clock;

    @Transactional
    public OrderDetailResponse openDispute(Long orderId, OpenDisputeRequest request, Actor buyer) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireBuyer(order, buyer);
        if (!order.getEscrow().isHeld()) {
            throw new InvalidStatusException("Disputes can only be opened while payment is held in escrow, escrow status: "
                    + order.getEscrow().getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.openDispute(request.getReason(), request.getDescription(), request.getEvidence(), now);
        order.addNote(NoteAuthorType.CUSTOMER, "Dispute opened: " + request.getReason(), buyer.label(), now);
        order = orderPersistence.commitEscrowTransition(order);

        log.info("Dispute opened on order {} by buyer {}: {}", order.getOrderNumber(), buyer.getUserId(), request.getReason());
        return orderMapper.convertToDetailResponse(order);
    }

    @Transactional
    public OrderDetailResponse startReview(Long orderId, Actor admin) {
        accessPolicy.requireAdmin(admin);
        Order order = loadDisputedOrder(orderId);

        LocalDateTime now = LocalDateTime.now(clock);
        order.startDisputeReview();
        order.addNote(NoteAuthorType.ADMIN, "Dispute taken under review", admin.label(), now);
        order = orderPersistence.commitStatusChange(order);

        log.info("Dispute on order {} under review by admin {}", order.getOrderNumber(), admin.getUserId());
        return orderMapper.convertToDetailResponse(order);
    }

    /**
     * Settles an active dispute. A positive refund amount refunds the buyer; otherwise the seller is paid.
     * A refund on an order that never reached the buyer ends the order as refunded and returns its stock.
     * Paying the seller requires a delivered order.
     */
    @Transactional
    public OrderDetailResponse resolveDispute(Long orderId, ResolveDisputeRequest request, Actor admin) {
        accessPolicy.requireAdmin(admin);
        Order order = loadDisputedOrder(orderId);
        BigDecimal refundAmount = validateResolution(order, request);
        if (!order.hasActiveDispute()) {
            throw new InvalidStatusException("Dispute on order " + order.getOrderNumber()
                    + " is not open, current status: " + order.getDispute().getStatus());
        }

        boolean refunded = refundAmount.signum() > 0;
        if (!refunded && order.getStatus() != OrderStatus.DELIVERED) {
            throw new InvalidStatusException("Escrow on order " + order.getOrderNumber()
                    + " can only be released to the seller after delivery, current status: " + order.getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        boolean returnsStock = refunded && order.getStatus().isPreDelivery();
        if (refunded) {
            order.refundForDispute("Dispute resolution: " + request.getResolution(), refundAmount,
                    request.getAdminNotes(), now);
        } else {
            order.getEscrow().releaseToSeller(now, admin.label());
        }
        order.resolveDispute(request.getResolution(), admin.label(), now);

        String note = refunded
                ? "Dispute resolved with refund of " + refundAmount + ": " + request.getResolution()
                : "Dispute resolved in favour of seller: " + request.getResolution();
        order.addNote(NoteAuthorType.ADMIN, note, admin.label(), now);
        order = orderPersistence.commitEscrowTransition(order);
        if (!refunded) {
            escrowService.creditSeller(order);
        } else if (returnsStock) {
            for (OrderItem item : order.getItems()) {
                inventoryService.release(item.getProductId(), item.getQuantity());
            }
        }

        log.info("Dispute on order {} resolved by admin {}: escrow {}", order.getOrderNumber(), admin.getUserId(),
                order.getEscrow().getStatus());
        return orderMapper.convertToDetailResponse(order);
    }

    /**
     * Closes a dispute without touching the escrow, so the normal auto-release applies again.
     */
    @Transactional
    public OrderDetailResponse closeDispute(Long orderId, String note, Actor admin) {
        accessPolicy.requireAdmin(admin);
        Order order = loadDisputedOrder(orderId);

        LocalDateTime now = LocalDateTime.now(clock);
        String message = note == null || note.isBlank() ? "Dispute closed" : "Dispute closed: " + note;
        order.closeDispute(message, admin.label(), now);
        order.addNote(NoteAuthorType.ADMIN, message, admin.label(), now);
        order = orderPersistence.commitStatusChange(order);

        log.info("Dispute on order {} closed by admin {}", order.getOrderNumber(), admin.getUserId());
        return orderMapper.convertToDetailResponse(order);
    }

    public PagedResponse<OrderListResponse> getDisputes(DisputeStatus status, Pageable pageable, Actor admin) {
        accessPolicy.requireAdmin(admin);
        Page<Order> disputes = status == null
                ? orderRepository.findDisputes(pageable)
                : orderRepository.findDisputesByStatus(status, pageable);

        Map<String, Object> summary = new LinkedHashMap<>();
        for (DisputeStatus each : DisputeStatus.values()) {
            summary.put(each.name().toLowerCase(), orderRepository.countByDisputeStatus(each));
        }
        return PagedResponse.of(disputes.map(orderMapper::convertToListResponse), summary);
    }

    private Order loadDisputedOrder(Long orderId) {
        Order order = orderPersistence.load(orderId);
        if (!Boolean.TRUE.equals(order.getDispute().getIsDisputed())) {
            throw new ResourceNotFoundException("No dispute found for order " + order.getOrderNumber());
        }
        return order;
    }

    private BigDecimal validateResolution(Order order, ResolveDisputeRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request.getResolution() == null || request.getResolution().isBlank()) {
            errors.put("resolution", "Resolution is required");
        }
        BigDecimal refundAmount = request.getRefundAmount() == null ? BigDecimal.ZERO : request.getRefundAmount();
        if (refundAmount.signum() < 0) {
            errors.put("refundAmount", "Refund amount cannot be negative");
        } else if (refundAmount.compareTo(order.getTotal()) > 0) {
            errors.put("refundAmount", "Refund amount cannot exceed the order total of " + order.getTotal());
        }
        if (!errors.isEmpty()) {
            throw new ValidationFailedException(errors);
        }
        return refundAmount;
    }
}
