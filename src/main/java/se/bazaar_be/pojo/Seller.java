package se.bazaar_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.pojo.enums.BusinessType;
import se.bazaar_be.pojo.enums.TrustBadge;
import se.bazaar_be.pojo.enums.VerificationStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "sellers", indexes = {
        @Index(name = "idx_sellers_verification", columnList = "verification_status, is_active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Seller extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long sellerId;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    @Column(nullable = false, length = 150)
    private String businessName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private BusinessType businessType;

    @Column(length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private VerificationStatus verificationStatus = VerificationStatus.PENDING;

    @Setter(AccessLevel.NONE)
    private LocalDateTime verifiedAt;

    @Setter(AccessLevel.NONE)
    private Long verifiedBy;

    @Column(length = 500)
    @Setter(AccessLevel.NONE)
    private String rejectionReason;

    @OneToMany(mappedBy = "seller", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    @Builder.Default
    @ToString.Exclude
    private List<SellerDocument> documents = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "seller_trust_badges", joinColumns = @JoinColumn(name = "seller_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "badge", length = 30)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Set<TrustBadge> trustBadges = EnumSet.noneOf(TrustBadge.class);

    @Column(precision = 3, scale = 2)
    @Builder.Default
    private BigDecimal ratingAverage = BigDecimal.ZERO;

    @Builder.Default
    private Integer ratingCount = 0;

    @Column(precision = 14, scale = 2)
    @Builder.Default
    private BigDecimal totalSales = BigDecimal.ZERO;

    @Builder.Default
    private Integer totalOrders = 0;

    // stays false until an admin verifies the seller
    @Column(name = "is_active", nullable = false)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Boolean isActive = false;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "seller_admin_notes", joinColumns = @JoinColumn(name = "seller_id"))
    @OrderColumn(name = "note_index")
    @Builder.Default
    @ToString.Exclude
    private List<AdminNote> adminNotes = new ArrayList<>();

    /**
     * Whether this seller may list products, hold trust badges and receive orders.
     */
    public boolean isEligibleToSell() {
        return verificationStatus == VerificationStatus.VERIFIED && Boolean.TRUE.equals(isActive);
    }

    public void moveToReview() {
        transitionTo(VerificationStatus.UNDER_REVIEW);
        this.rejectionReason = null;
    }

    public void verify(Long adminId, Collection<TrustBadge> badges, LocalDateTime now) {
        transitionTo(VerificationStatus.VERIFIED);
        this.verifiedAt = now;
        this.verifiedBy = adminId;
        this.isActive = true;
        this.rejectionReason = null;
        if (badges != null && !badges.isEmpty()) {
            this.trustBadges.clear();
            this.trustBadges.addAll(badges);
        }
    }

    public void reject(String reason) {
        transitionTo(VerificationStatus.REJECTED);
        this.rejectionReason = reason;
        this.isActive = false;
        this.trustBadges.clear();
    }

    public void addAdminNote(String note, Long adminId, LocalDateTime now) {
        adminNotes.add(AdminNote.builder().note(note).addedBy(adminId).addedAt(now).build());
    }

    public void addDocument(SellerDocument document) {
        document.setSeller(this);
        documents.add(document);
    }

    private void transitionTo(VerificationStatus target) {
        if (!verificationStatus.canTransitionTo(target)) {
            throw new InvalidStatusException("Seller verification cannot move from " + verificationStatus + " to " + target);
        }
        this.verificationStatus = target;
    }
}
