package se.bazaar_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.pojo.enums.DisputeStatus;
import se.bazaar_be.pojo.enums.NoteAuthorType;
import se.bazaar_be.pojo.enums.OrderStatus;
import se.bazaar_be.pojo.enums.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical order record. The escrow, dispute and refund sub-records live in the same row and are
 * only changed through the methods on this class and on {@link Escrow}; the {@code version}
 * column makes every commit a compare-and-set against the state that was read.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_buyer", columnList = "buyer_id, created_at"),
        @Index(name = "idx_orders_seller", columnList = "seller_id, created_at"),
        @Index(name = "idx_orders_status", columnList = "status"),
        @Index(name = "idx_orders_escrow_status", columnList = "escrow_status, escrow_auto_release_at")
})
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Order extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long orderId;

    @Column(nullable = false, unique = true, length = 20)
    private String orderNumber;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("orderItemId ASC")
    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    @Embedded
    private OrderPricing pricing;

    @Embedded
    private ShippingAddress shippingAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING_PAYMENT;

    @Embedded
    @Builder.Default
    private Escrow escrow = new Escrow();

    @Embedded
    private PaymentInfo payment;

    @Embedded
    @Builder.Default
    private ShippingInfo shipping = new ShippingInfo();

    @Embedded
    @Builder.Default
    private CustomerFeedback customerFeedback = new CustomerFeedback();

    @Embedded
    @Builder.Default
    private Dispute dispute = new Dispute();

    @Embedded
    @Builder.Default
    private Refund refund = new Refund();

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("noteId ASC")
    @Builder.Default
    private List<OrderNote> notes = new ArrayList<>();

    @Version
    private Long version;

    // Hibernate hands back null for an embedded value whose columns are all null.
    public ShippingInfo getShipping() {
        if (shipping == null) {
            shipping = new ShippingInfo();
        }
        return shipping;
    }

    public CustomerFeedback getCustomerFeedback() {
        if (customerFeedback == null) {
            customerFeedback = new CustomerFeedback();
        }
        return customerFeedback;
    }

    public Dispute getDispute() {
        if (dispute == null) {
            dispute = new Dispute();
        }
        return dispute;
    }

    public Refund getRefund() {
        if (refund == null) {
            refund = new Refund();
        }
        return refund;
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public List<OrderNote> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }

    public void addNote(NoteAuthorType type, String message, String createdBy, LocalDateTime now) {
        notes.add(OrderNote.builder()
                .order(this)
                .type(type)
                .message(message)
                .createdBy(createdBy)
                .createdAt(now)
                .build());
    }

    public BigDecimal getTotal() {
        return pricing.getTotal();
    }

    public LocalDateTime getDeliveredAt() {
        return getShipping().getDeliveredAt();
    }

    public void changeStatus(OrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusException("Order " + orderNumber + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    public void markShipped(String trackingNumber, String carrier, LocalDate estimatedDelivery, LocalDateTime now) {
        changeStatus(OrderStatus.SHIPPED);
        ShippingInfo info = getShipping();
        info.setTrackingNumber(trackingNumber);
        info.setCarrier(carrier);
        info.setEstimatedDelivery(estimatedDelivery);
        info.setShippedAt(now);
    }

    public void markDelivered(LocalDateTime now, String deliveryNotes) {
        changeStatus(OrderStatus.DELIVERED);
        getShipping().setDeliveredAt(now);
        getShipping().setDeliveryNotes(deliveryNotes);
    }

    public void openDispute(String reason, String description, List<String> evidence, LocalDateTime now) {
        getDispute().open(reason, description, evidence, now);
    }

    public void startDisputeReview() {
        getDispute().startReview();
    }

    public void resolveDispute(String resolution, String resolvedBy, LocalDateTime now) {
        getDispute().finish(DisputeStatus.RESOLVED, resolution, resolvedBy, now);
    }

    public void closeDispute(String note, String closedBy, LocalDateTime now) {
        getDispute().finish(DisputeStatus.CLOSED, note, closedBy, now);
    }

    public boolean hasActiveDispute() {
        return getDispute().isActive();
    }

    public void requestRefund(String reason, LocalDateTime now) {
        getRefund().request(reason, pricing.getTotal(), now);
    }

    /**
     * Dispute settled in the buyer's favour. Orders that never reached the buyer end as refunded.
     */
    public void refundForDispute(String reason, BigDecimal amount, String adminNotes, LocalDateTime now) {
        escrow.refundToCustomer();
        getRefund().complete(reason, amount, payment != null ? payment.getMethod().name() : null, adminNotes, now);
        if (status.isPreDelivery()) {
            changeStatus(OrderStatus.REFUNDED);
        }
    }

    /**
     * Payment captured by the gateway: the order moves on and the money is held in escrow.
     */
    public void confirmPayment(String transactionId, LocalDateTime now) {
        changeStatus(OrderStatus.PAYMENT_CONFIRMED);
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setTransactionId(transactionId);
        payment.setPaidAt(now);
        escrow.hold(now);
    }

    public void recordPaymentFailure(String transactionId) {
        payment.setStatus(PaymentStatus.FAILED);
        if (transactionId != null) {
            payment.setTransactionId(transactionId);
        }
    }

    /**
     * Gateway-initiated refund of held funds. Orders that never reached the buyer end as refunded.
     */
    public void recordGatewayRefund(String refundId, BigDecimal amount, LocalDateTime now) {
        escrow.refundToCustomer();
        payment.setStatus(PaymentStatus.REFUNDED);
        payment.setRefundId(refundId);
        payment.setRefundedAt(now);
        Refund current = getRefund();
        String reason = current.getReason() != null ? current.getReason() : "Refunded through payment gateway";
        current.complete(reason, amount, payment.getMethod().name(), null, now);
        if (status.isPreDelivery()) {
            changeStatus(OrderStatus.REFUNDED);
        }
    }

    public void recordFeedback(int rating, String review, LocalDateTime now) {
        CustomerFeedback feedback = getCustomerFeedback();
        feedback.setRating(rating);
        feedback.setReview(review);
        feedback.setReviewedAt(now);
    }
}
