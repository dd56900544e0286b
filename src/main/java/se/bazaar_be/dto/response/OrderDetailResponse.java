package se.bazaar_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.bazaar_be.pojo.PaymentInfo;
import se.bazaar_be.pojo.ShippingAddress;
import se.bazaar_be.pojo.ShippingInfo;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderDetailResponse {
    private Long orderId;
    private String orderNumber;
    private Long buyerId;
    private Long sellerId;
    private String status;
    private Instant createdAt;
    private Instant updatedAt;

    private List<OrderItemDetail> items;
    private PricingInfo pricing;
    private ShippingAddress shippingAddress;
    private PaymentInfo payment;
    private ShippingInfo shipping;
    private EscrowInfo escrow;
    private DisputeInfo dispute;
    private RefundInfo refund;
    private FeedbackInfo feedback;
    private List<NoteInfo> notes;
    private TrustStatus trustStatus;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderItemDetail {
        private Long orderItemId;
        private Long productId;
        private Integer quantity;
        private BigDecimal unitPrice;
        private BigDecimal lineTotal;
        private String name;
        private String image;
        private String sku;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PricingInfo {
        private BigDecimal subtotal;
        private BigDecimal shippingCost;
        private BigDecimal tax;
        private BigDecimal discount;
        private BigDecimal total;
        private String currency;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EscrowInfo {
        private String status;
        private LocalDateTime holdUntil;
        private LocalDateTime autoReleaseAt;
        private Boolean releaseRequested;
        private LocalDateTime releaseRequestedAt;
        private Boolean customerApproval;
        private LocalDateTime customerApprovalAt;
        private LocalDateTime releasedAt;
        private String releasedBy;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DisputeInfo {
        private Boolean isDisputed;
        private String status;
        private String reason;
        private String description;
        private List<String> evidence;
        private LocalDateTime createdAt;
        private String resolution;
        private String resolvedBy;
        private LocalDateTime resolvedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RefundInfo {
        private Boolean isRefunded;
        private String reason;
        private BigDecimal amount;
        private LocalDateTime requestedAt;
        private LocalDateTime approvedAt;
        private LocalDateTime processedAt;
        private String refundMethod;
        private String adminNotes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeedbackInfo {
        private Integer rating;
        private String review;
        private LocalDateTime reviewedAt;
        private Boolean isVerifiedPurchase;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NoteInfo {
        private String type;
        private String message;
        private String createdBy;
        private LocalDateTime createdAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrustStatus {
        private String escrowProtection;
        private boolean canRequestRefund;
        private boolean canRequestRelease;
        private boolean disputeAvailable;
        private ReturnWindow returnWindow;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReturnWindow {
        private long totalDays;
        private long remainingDays;
        private boolean expired;
    }
}
