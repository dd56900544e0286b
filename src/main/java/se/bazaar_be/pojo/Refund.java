package se.bazaar_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Embeddable
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Refund {

    @Column(name = "refund_is_refunded", nullable = false)
    @Builder.Default
    private Boolean isRefunded = false;

    @Column(name = "refund_reason", length = 255)
    private String reason;

    @Column(name = "refund_amount", precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "refund_requested_at")
    private LocalDateTime requestedAt;

    @Column(name = "refund_approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "refund_processed_at")
    private LocalDateTime processedAt;

    @Column(name = "refund_method", length = 30)
    private String refundMethod;

    @Column(name = "refund_admin_notes", columnDefinition = "text")
    private String adminNotes;

    public boolean isRequested() {
        return requestedAt != null;
    }

    void request(String reason, BigDecimal amount, LocalDateTime now) {
        this.isRefunded = false;
        this.reason = reason;
        this.amount = amount;
        this.requestedAt = now;
        this.approvedAt = null;
        this.processedAt = null;
    }

    void complete(String reason, BigDecimal amount, String refundMethod, String adminNotes, LocalDateTime now) {
        this.isRefunded = true;
        this.reason = reason;
        this.amount = amount;
        if (this.requestedAt == null) {
            this.requestedAt = now;
        }
        this.approvedAt = now;
        this.processedAt = now;
        this.refundMethod = refundMethod;
        this.adminNotes = adminNotes;
    }
}
