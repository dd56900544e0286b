package se.bazaar_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import se.bazaar_be.exception.InvalidEscrowTransitionException;
import se.bazaar_be.pojo.enums.EscrowStatus;

import java.time.LocalDateTime;

/**
 * Escrow sub-record of an order. Fields are only written through the transition methods below,
 * which reject every edge {@link EscrowStatus#canTransitionTo} does not allow. Once the escrow
 * reaches a terminal state nothing on it changes again.
 */
@Embeddable
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Escrow {

    @Enumerated(EnumType.STRING)
    @Column(name = "escrow_status", nullable = false, length = 30)
    @Builder.Default
    private EscrowStatus status = EscrowStatus.PENDING;

    @Column(name = "escrow_hold_until")
    private LocalDateTime holdUntil;

    @Column(name = "escrow_release_requested")
    @Builder.Default
    private Boolean releaseRequested = false;

    @Column(name = "escrow_release_requested_at")
    private LocalDateTime releaseRequestedAt;

    @Column(name = "escrow_customer_approval")
    @Builder.Default
    private Boolean customerApproval = false;

    @Column(name = "escrow_customer_approval_at")
    private LocalDateTime customerApprovalAt;

    @Column(name = "escrow_auto_release_at")
    private LocalDateTime autoReleaseAt;

    @Column(name = "escrow_released_at")
    private LocalDateTime releasedAt;

    @Column(name = "escrow_released_by", length = 50)
    private String releasedBy;

    public boolean isHeld() {
        return status == EscrowStatus.HELD;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves {@code pending -> held}. The first transition to held is authoritative; calling this on an
     * escrow that is already held is a no-op and returns {@code false}.
     */
    public boolean hold(LocalDateTime now) {
        if (status == EscrowStatus.HELD) {
            return false;
        }
        transition(EscrowStatus.HELD);
        this.holdUntil = now;
        return true;
    }

    /**
     * Sets the auto-release deadline. Only ever set once per escrow.
     */
    public void armAutoRelease(LocalDateTime deliveredAt, int holdDays) {
        requireMutable(EscrowStatus.HELD);
        if (autoReleaseAt != null) {
            return;
        }
        this.autoReleaseAt = deliveredAt.plusDays(holdDays);
    }

    public boolean isAutoReleaseDue(LocalDateTime now) {
        return status == EscrowStatus.HELD && autoReleaseAt != null && !autoReleaseAt.isAfter(now);
    }

    public void markReleaseRequested(LocalDateTime now) {
        requireMutable(EscrowStatus.HELD);
        if (Boolean.TRUE.equals(releaseRequested)) {
            return;
        }
        this.releaseRequested = true;
        this.releaseRequestedAt = now;
    }

    public void approveAndRelease(LocalDateTime now, String approvedBy) {
        transition(EscrowStatus.RELEASED_TO_SELLER);
        this.customerApproval = true;
        this.customerApprovalAt = now;
        this.releasedAt = now;
        this.releasedBy = approvedBy;
    }

    public void releaseToSeller(LocalDateTime now, String releasedBy) {
        transition(EscrowStatus.RELEASED_TO_SELLER);
        this.releasedAt = now;
        this.releasedBy = releasedBy;
    }

    public void refundToCustomer() {
        transition(EscrowStatus.REFUNDED_TO_CUSTOMER);
    }

    private void transition(EscrowStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidEscrowTransitionException(status, target);
        }
        this.status = target;
    }

    private void requireMutable(EscrowStatus attempted) {
        if (status != EscrowStatus.HELD) {
            throw new InvalidEscrowTransitionException(status, attempted);
        }
    }
}
