package se.bazaar_be.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.GatewayRefundRequest;
import se.bazaar_be.dto.request.OpenDisputeRequest;
import se.bazaar_be.dto.request.OrderCreateRequest;
import se.bazaar_be.dto.request.RefundRequest;
import se.bazaar_be.dto.request.ResolveDisputeRequest;
import se.bazaar_be.dto.request.ShipOrderRequest;
import se.bazaar_be.dto.response.EscrowStatisticsResponse;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.exception.InsufficientStockException;
import se.bazaar_be.exception.InvalidEscrowTransitionException;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.exception.ProductUnavailableException;
import se.bazaar_be.exception.RefundNotAllowedException;
import se.bazaar_be.pojo.Product;
import se.bazaar_be.pojo.Seller;
import se.bazaar_be.pojo.enums.DisputeStatus;
import se.bazaar_be.service.DisputeService;
import se.bazaar_be.service.RefundService;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Escrow lifecycle against the database")
class EscrowLifecycleIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private DisputeService disputeService;

    @Autowired
    private RefundService refundService;

    @Test
    @DisplayName("Ordering the last two units empties stock and the next order fails")
    void lastUnitsAreSoldOnce() {
        // Given
        Seller seller = verifiedSeller();
        Product product = product(seller, "450.00", 2);

        // When
        placeOrder(newBuyer(), product, 2);

        // Then
        assertThat(inventoryService.availableStock(product.getProductId())).isZero();
        assertThatThrownBy(() -> placeOrder(newBuyer(), product, 1))
                .isInstanceOf(InsufficientStockException.class);
        assertThat(inventoryService.availableStock(product.getProductId())).isZero();
    }

    @Test
    @DisplayName("Products of an unverified seller cannot be ordered and stock is untouched")
    void unverifiedSellerProductIsUnavailable() {
        // Given
        Product product = product(pendingSeller(), "300.00", 5);

        // When / Then
        assertThatThrownBy(() -> placeOrder(newBuyer(), product, 1))
                .isInstanceOf(ProductUnavailableException.class);
        assertThat(inventoryService.availableStock(product.getProductId())).isEqualTo(5);
    }

    @Test
    @DisplayName("Order creation prices lines from the catalog and charges shipping below the threshold")
    void createOrderPricesFromCatalog() {
        // Given
        Seller seller = verifiedSeller();
        Product product = product(seller, "250.00", 10);

        // When
        OrderDetailResponse order = orderService.createOrder(orderRequest(List.of(
                OrderCreateRequest.OrderItemRequest.builder().productId(product.getProductId()).quantity(1).build(),
                OrderCreateRequest.OrderItemRequest.builder().productId(product.getProductId()).quantity(2).build())),
                newBuyer());

        // Then
        assertThat(order.getItems()).hasSize(1);
        assertThat(order.getItems().get(0).getQuantity()).isEqualTo(3);
        assertThat(order.getPricing().getSubtotal()).isEqualByComparingTo("750.00");
        assertThat(order.getPricing().getShippingCost()).isEqualByComparingTo("60");
        assertThat(order.getPricing().getTotal()).isEqualByComparingTo("810.00");
        assertThat(order.getOrderNumber()).startsWith("BD").hasSize(11);
        assertThat(order.getEscrow().getStatus()).isEqualTo("PENDING");
        assertThat(inventoryService.availableStock(product.getProductId())).isEqualTo(7);
    }

    @Test
    @DisplayName("Delivery on day 0 schedules auto-release for day 7 and the sweep releases on day 8")
    void autoReleaseAfterHoldPeriod() {
        // Given
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Long orderId = deliveredOrder(buyer, seller, product(seller, "500.00", 3), 1);

        OrderDetailResponse delivered = orderService.getOrder(orderId, ADMIN);
        LocalDateTime deliveredAt = delivered.getShipping().getDeliveredAt();
        assertThat(delivered.getEscrow().getAutoReleaseAt()).isEqualTo(deliveredAt.plusDays(7));
        assertThat(delivered.getEscrow().getStatus()).isEqualTo("HELD");

        // When
        advanceDays(8);
        boolean released = escrowService.autoRelease(orderId);

        // Then
        OrderDetailResponse after = orderService.getOrder(orderId, ADMIN);
        assertThat(released).isTrue();
        assertThat(after.getEscrow().getStatus()).isEqualTo("RELEASED_TO_SELLER");
        assertThat(after.getEscrow().getReleasedBy()).isEqualTo("system");
        assertThat(sellerRepository.findById(seller.getSellerId()).orElseThrow().getTotalOrders()).isEqualTo(1);
    }

    @Test
    @DisplayName("Auto-release is not due before the deadline")
    void autoReleaseNotDueBeforeDeadline() {
        Seller seller = verifiedSeller();
        Long orderId = deliveredOrder(newBuyer(), seller, product(seller, "500.00", 3), 1);

        advanceDays(6);

        assertThat(escrowService.autoRelease(orderId)).isFalse();
        assertThat(orderService.getOrder(orderId, ADMIN).getEscrow().getStatus()).isEqualTo("HELD");
    }

    @Test
    @DisplayName("Buyer approval on day 2 releases escrow and the day 8 sweep is a no-op")
    void buyerApprovalBeatsSweep() {
        // Given
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Long orderId = deliveredOrder(buyer, seller, product(seller, "500.00", 3), 1);

        // When
        advanceDays(2);
        escrowService.approveDelivery(orderId, buyer);
        advanceDays(6);
        boolean sweptAgain = escrowService.autoRelease(orderId);

        // Then
        OrderDetailResponse order = orderService.getOrder(orderId, ADMIN);
        assertThat(sweptAgain).isFalse();
        assertThat(order.getEscrow().getStatus()).isEqualTo("RELEASED_TO_SELLER");
        assertThat(order.getEscrow().getCustomerApproval()).isTrue();
        assertThat(order.getEscrow().getReleasedBy()).isEqualTo(buyer.label());
        assertThatThrownBy(() -> escrowService.approveDelivery(orderId, buyer))
                .isInstanceOf(InvalidEscrowTransitionException.class);
    }

    @Test
    @DisplayName("Confirming delivery twice fails and keeps the original deadline")
    void secondDeliveryConfirmationFails() {
        Seller seller = verifiedSeller();
        Long orderId = deliveredOrder(newBuyer(), seller, product(seller, "500.00", 3), 1);
        LocalDateTime deadline = orderService.getOrder(orderId, ADMIN).getEscrow().getAutoReleaseAt();

        advanceDays(3);

        assertThatThrownBy(() -> escrowService.confirmDelivery(orderId, null, actorFor(seller)))
                .isInstanceOf(InvalidStatusException.class);
        assertThat(orderService.getOrder(orderId, ADMIN).getEscrow().getAutoReleaseAt()).isEqualTo(deadline);
    }

    @Test
    @DisplayName("Admin resolving a dispute with a 500 refund refunds the buyer")
    void disputeResolvedWithRefund() {
        // Given
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Long orderId = deliveredOrder(buyer, seller, product(seller, "1200.00", 2), 1);
        disputeService.openDispute(orderId, OpenDisputeRequest.builder()
                .reason("Item not as described")
                .evidence(List.of("https://cdn.example.com/evidence-1.jpg"))
                .build(), buyer);

        // When
        OrderDetailResponse resolved = disputeService.resolveDispute(orderId, ResolveDisputeRequest.builder()
                .resolution("Partial refund agreed")
                .refundAmount(new BigDecimal("500"))
                .build(), ADMIN);

        // Then
        assertThat(resolved.getEscrow().getStatus()).isEqualTo("REFUNDED_TO_CUSTOMER");
        assertThat(resolved.getRefund().getAmount()).isEqualByComparingTo("500");
        assertThat(resolved.getRefund().getIsRefunded()).isTrue();
        assertThat(resolved.getDispute().getStatus()).isEqualTo("RESOLVED");
        assertThat(resolved.getDispute().getResolvedBy()).isEqualTo(ADMIN.label());
        assertThat(resolved.getDispute().getEvidence()).containsExactly("https://cdn.example.com/evidence-1.jpg");

        advanceDays(10);
        assertThat(escrowService.autoRelease(orderId)).isFalse();
    }

    @Test
    @DisplayName("An open dispute blocks auto-release until the admin closes it")
    void closedDisputeReenablesAutoRelease() {
        // Given
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Long orderId = deliveredOrder(buyer, seller, product(seller, "800.00", 2), 1);
        disputeService.openDispute(orderId, OpenDisputeRequest.builder().reason("Late delivery").build(), buyer);
        advanceDays(8);

        // When / Then
        assertThat(escrowService.autoRelease(orderId)).isFalse();

        disputeService.closeDispute(orderId, "Buyer withdrew complaint", ADMIN);
        assertThat(escrowService.autoRelease(orderId)).isTrue();
        assertThat(orderService.getOrder(orderId, ADMIN).getDispute().getStatus()).isEqualTo("CLOSED");
    }

    @Test
    @DisplayName("Refund requests are accepted inside the window and only once")
    void refundRequestWindow() {
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Long orderId = deliveredOrder(buyer, seller, product(seller, "500.00", 3), 1);

        advanceDays(1);
        OrderDetailResponse requested = refundService.requestRefund(orderId,
                RefundRequest.builder().reason("Wrong size").build(), buyer);

        assertThat(requested.getRefund().getAmount()).isEqualByComparingTo(requested.getPricing().getTotal());
        assertThat(requested.getRefund().getIsRefunded()).isFalse();
        assertThat(requested.getTrustStatus().isCanRequestRefund()).isFalse();
        assertThatThrownBy(() -> refundService.requestRefund(orderId,
                RefundRequest.builder().reason("Again").build(), buyer))
                .isInstanceOf(RefundNotAllowedException.class);
    }

    @Test
    @DisplayName("Cancelling an unpaid order returns its stock")
    void cancelReturnsStock() {
        Seller seller = verifiedSeller();
        Product product = product(seller, "100.00", 4);
        Actor buyer = newBuyer();
        Long orderId = placeOrder(buyer, product, 3);
        assertThat(inventoryService.availableStock(product.getProductId())).isEqualTo(1);

        OrderDetailResponse cancelled = orderService.cancelOrder(orderId, "Changed my mind", buyer);

        assertThat(cancelled.getStatus()).isEqualTo("CANCELLED");
        assertThat(cancelled.getEscrow().getStatus()).isEqualTo("PENDING");
        assertThat(inventoryService.availableStock(product.getProductId())).isEqualTo(4);
    }

    @Test
    @DisplayName("A dispute refunded before shipping ends the order as refunded and returns its stock")
    void disputeRefundBeforeDelivery() {
        // Given
        Seller seller = verifiedSeller();
        Product product = product(seller, "300.00", 4);
        Actor buyer = newBuyer();
        Long orderId = paidOrder(buyer, product, 1);
        disputeService.openDispute(orderId, OpenDisputeRequest.builder().reason("Seller stopped responding").build(), buyer);
        assertThat(inventoryService.availableStock(product.getProductId())).isEqualTo(3);

        // When
        OrderDetailResponse resolved = disputeService.resolveDispute(orderId, ResolveDisputeRequest.builder()
                .resolution("Full refund, never shipped")
                .refundAmount(new BigDecimal("360"))
                .build(), ADMIN);

        // Then
        assertThat(resolved.getStatus()).isEqualTo("REFUNDED");
        assertThat(resolved.getEscrow().getStatus()).isEqualTo("REFUNDED_TO_CUSTOMER");
        assertThat(inventoryService.availableStock(product.getProductId())).isEqualTo(4);
        assertThatThrownBy(() -> orderService.startProcessing(orderId, actorFor(seller)))
                .isInstanceOf(InvalidStatusException.class);
    }

    @Test
    @DisplayName("A dispute cannot pay the seller before delivery and the order can still be delivered")
    void disputeReleaseBeforeDeliveryIsRefused() {
        // Given
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Actor sellerActor = actorFor(seller);
        Long orderId = paidOrder(buyer, product(seller, "300.00", 4), 1);
        disputeService.openDispute(orderId, OpenDisputeRequest.builder().reason("Slow dispatch").build(), buyer);

        // When
        assertThatThrownBy(() -> disputeService.resolveDispute(orderId, ResolveDisputeRequest.builder()
                .resolution("Seller is on schedule")
                .refundAmount(BigDecimal.ZERO)
                .build(), ADMIN))
                .isInstanceOf(InvalidStatusException.class);

        // Then
        OrderDetailResponse unchanged = orderService.getOrder(orderId, ADMIN);
        assertThat(unchanged.getEscrow().getStatus()).isEqualTo("HELD");
        assertThat(unchanged.getDispute().getStatus()).isEqualTo("OPEN");

        disputeService.closeDispute(orderId, "Buyer agreed to wait", ADMIN);
        orderService.startProcessing(orderId, sellerActor);
        orderService.markShipped(orderId, ShipOrderRequest.builder().trackingNumber("PTH-9").carrier("Pathao").build(), sellerActor);
        OrderDetailResponse delivered = escrowService.confirmDelivery(orderId, null, sellerActor);
        assertThat(delivered.getStatus()).isEqualTo("DELIVERED");
        assertThat(delivered.getEscrow().getStatus()).isEqualTo("HELD");
    }

    @Test
    @DisplayName("A gateway refund closes the active dispute and removes it from the open queue")
    void gatewayRefundClosesDispute() {
        // Given
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Long orderId = deliveredOrder(buyer, seller, product(seller, "700.00", 2), 1);
        disputeService.openDispute(orderId, OpenDisputeRequest.builder().reason("Counterfeit").build(), buyer);

        // When
        paymentService.recordGatewayRefund(orderId, GatewayRefundRequest.builder()
                .refundId("RF-" + orderId)
                .amount(new BigDecimal("760"))
                .build(), ADMIN);

        // Then
        OrderDetailResponse order = orderService.getOrder(orderId, ADMIN);
        assertThat(order.getEscrow().getStatus()).isEqualTo("REFUNDED_TO_CUSTOMER");
        assertThat(order.getDispute().getStatus()).isEqualTo("CLOSED");
        assertThat(disputeService.getDisputes(DisputeStatus.OPEN, PageRequest.of(0, 500), ADMIN).getContent())
                .noneMatch(listed -> listed.getOrderId().equals(orderId));
    }

    @Test
    @DisplayName("Product sales are counted on release, not on reservation")
    void productSalesCountedOnRelease() {
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Product product = product(seller, "500.00", 5);
        Long orderId = deliveredOrder(buyer, seller, product, 2);
        assertThat(productRepository.findById(product.getProductId()).orElseThrow().getTotalSales()).isZero();

        escrowService.approveDelivery(orderId, buyer);

        assertThat(productRepository.findById(product.getProductId()).orElseThrow().getTotalSales()).isEqualTo(2);
    }

    @Test
    @DisplayName("Escrow statistics move with held and refunded orders")
    void escrowStatisticsTrackRefunds() {
        // Given
        EscrowStatisticsResponse before = orderService.getEscrowStatistics(ADMIN);
        Seller seller = verifiedSeller();
        Product product = product(seller, "200.00", 5);
        paidOrder(newBuyer(), product, 1);
        Long refundedId = paidOrder(newBuyer(), product, 1);

        // When
        paymentService.recordGatewayRefund(refundedId, GatewayRefundRequest.builder()
                .refundId("RF-" + refundedId)
                .amount(new BigDecimal("260"))
                .build(), ADMIN);
        EscrowStatisticsResponse after = orderService.getEscrowStatistics(ADMIN);

        // Then
        assertThat(after.getTotalOrders()).isEqualTo(before.getTotalOrders() + 2);
        assertThat(after.getEscrowHeld()).isEqualTo(before.getEscrowHeld() + 1);
        assertThat(after.getHeldAmount()).isEqualByComparingTo(before.getHeldAmount().add(new BigDecimal("260")));
        assertThat(after.getRefundedToCustomer()).isEqualTo(before.getRefundedToCustomer() + 1);
        assertThat(after.getRefundedOrders()).isEqualTo(before.getRefundedOrders() + 1);
        assertThat(after.getRefundRate()).isPositive();
    }
}
