package se.bazaar_be.mapper;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.dto.response.OrderListResponse;
import se.bazaar_be.pojo.*;
import se.bazaar_be.pojo.enums.OrderStatus;
import se.bazaar_be.service.RefundPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts order entities to response DTOs. Must be called inside the transaction that loaded the
 * order, since items and notes are lazy.
 */
@Component
@RequiredArgsConstructor
public class OrderMapper {

    private final RefundPolicy refundPolicy;

    public OrderDetailResponse convertToDetailResponse(Order order) {
        List<OrderDetailResponse.OrderItemDetail> items = order.getItems().stream()
                .map(this::convertToItemDetail)
                .collect(Collectors.toList());

        List<OrderDetailResponse.NoteInfo> notes = order.getNotes().stream()
                .map(note -> OrderDetailResponse.NoteInfo.builder()
                        .type(note.getType().name().toLowerCase())
                        .message(note.getMessage())
                        .createdBy(note.getCreatedBy())
                        .createdAt(note.getCreatedAt())
                        .build())
                .collect(Collectors.toList());

        return OrderDetailResponse.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .buyerId(order.getBuyerId())
                .sellerId(order.getSellerId())
                .status(order.getStatus().name())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .items(items)
                .pricing(convertToPricingInfo(order.getPricing()))
                .shippingAddress(order.getShippingAddress())
                .payment(order.getPayment())
                .shipping(order.getShipping())
                .escrow(convertToEscrowInfo(order.getEscrow()))
                .dispute(convertToDisputeInfo(order.getDispute()))
                .refund(convertToRefundInfo(order.getRefund()))
                .feedback(convertToFeedbackInfo(order.getCustomerFeedback()))
                .notes(notes)
                .trustStatus(buildTrustStatus(order))
                .build();
    }

    public OrderListResponse convertToListResponse(Order order) {
        int totalItems = order.getItems().stream()
                .mapToInt(OrderItem::getQuantity)
                .sum();
        Dispute dispute = order.getDispute();
        return OrderListResponse.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .buyerId(order.getBuyerId())
                .sellerId(order.getSellerId())
                .status(order.getStatus().name())
                .escrowStatus(order.getEscrow().getStatus().name())
                .autoReleaseAt(order.getEscrow().getAutoReleaseAt())
                .disputeStatus(dispute.getStatus() != null ? dispute.getStatus().name() : null)
                .total(order.getTotal())
                .currency(order.getPricing().getCurrency())
                .totalItems(totalItems)
                .createdAt(order.getCreatedAt())
                .build();
    }

    private OrderDetailResponse.OrderItemDetail convertToItemDetail(OrderItem item) {
        ProductSnapshot snapshot = item.getProductSnapshot();
        return OrderDetailResponse.OrderItemDetail.builder()
                .orderItemId(item.getOrderItemId())
                .productId(item.getProductId())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .lineTotal(item.getLineTotal())
                .name(snapshot != null ? snapshot.getName() : null)
                .image(snapshot != null ? snapshot.getImage() : null)
                .sku(snapshot != null ? snapshot.getSku() : null)
                .build();
    }

    private OrderDetailResponse.PricingInfo convertToPricingInfo(OrderPricing pricing) {
        return OrderDetailResponse.PricingInfo.builder()
                .subtotal(pricing.getSubtotal())
                .shippingCost(pricing.getShippingCost())
                .tax(pricing.getTax())
                .discount(pricing.getDiscount())
                .total(pricing.getTotal())
                .currency(pricing.getCurrency())
                .build();
    }

    private OrderDetailResponse.EscrowInfo convertToEscrowInfo(Escrow escrow) {
        return OrderDetailResponse.EscrowInfo.builder()
                .status(escrow.getStatus().name())
                .holdUntil(escrow.getHoldUntil())
                .autoReleaseAt(escrow.getAutoReleaseAt())
                .releaseRequested(escrow.getReleaseRequested())
                .releaseRequestedAt(escrow.getReleaseRequestedAt())
                .customerApproval(escrow.getCustomerApproval())
                .customerApprovalAt(escrow.getCustomerApprovalAt())
                .releasedAt(escrow.getReleasedAt())
                .releasedBy(escrow.getReleasedBy())
                .build();
    }

    private OrderDetailResponse.DisputeInfo convertToDisputeInfo(Dispute dispute) {
        if (!Boolean.TRUE.equals(dispute.getIsDisputed())) {
            return null;
        }
        return OrderDetailResponse.DisputeInfo.builder()
                .isDisputed(true)
                .status(dispute.getStatus() != null ? dispute.getStatus().name() : null)
                .reason(dispute.getReason())
                .description(dispute.getDescription())
                .evidence(new ArrayList<>(dispute.getEvidence()))
                .createdAt(dispute.getCreatedAt())
                .resolution(dispute.getResolution())
                .resolvedBy(dispute.getResolvedBy())
                .resolvedAt(dispute.getResolvedAt())
                .build();
    }

    private OrderDetailResponse.RefundInfo convertToRefundInfo(Refund refund) {
        if (!refund.isRequested()) {
            return null;
        }
        return OrderDetailResponse.RefundInfo.builder()
                .isRefunded(refund.getIsRefunded())
                .reason(refund.getReason())
                .amount(refund.getAmount())
                .requestedAt(refund.getRequestedAt())
                .approvedAt(refund.getApprovedAt())
                .processedAt(refund.getProcessedAt())
                .refundMethod(refund.getRefundMethod())
                .adminNotes(refund.getAdminNotes())
                .build();
    }

    private OrderDetailResponse.FeedbackInfo convertToFeedbackInfo(CustomerFeedback feedback) {
        if (!feedback.isSubmitted()) {
            return null;
        }
        return OrderDetailResponse.FeedbackInfo.builder()
                .rating(feedback.getRating())
                .review(feedback.getReview())
                .reviewedAt(feedback.getReviewedAt())
                .isVerifiedPurchase(feedback.getIsVerifiedPurchase())
                .build();
    }

    private OrderDetailResponse.TrustStatus buildTrustStatus(Order order) {
        Escrow escrow = order.getEscrow();
        boolean delivered = order.getStatus() == OrderStatus.DELIVERED;
        return OrderDetailResponse.TrustStatus.builder()
                .escrowProtection(escrow.getStatus().name())
                .canRequestRefund(refundPolicy.canRequestRefund(order) && !order.getRefund().isRequested())
                .canRequestRelease(delivered && escrow.isHeld() && !Boolean.TRUE.equals(escrow.getReleaseRequested()))
                .disputeAvailable(escrow.isHeld() && !order.hasActiveDispute())
                .returnWindow(refundPolicy.returnWindow(order))
                .build();
    }
}
