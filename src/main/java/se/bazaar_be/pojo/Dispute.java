package se.bazaar_be.pojo;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.pojo.enums.DisputeStatus;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Embeddable
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Dispute {

    @Column(name = "dispute_is_disputed", nullable = false)
    @Builder.Default
    private Boolean isDisputed = false;

    @Column(name = "dispute_reason", length = 255)
    private String reason;

    @Column(name = "dispute_description", columnDefinition = "text")
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_dispute_evidence", joinColumns = @JoinColumn(name = "order_id"))
    @Column(name = "evidence_url", length = 512)
    @Builder.Default
    @ToString.Exclude
    private List<String> evidence = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "dispute_status", length = 20)
    private DisputeStatus status;

    @Column(name = "dispute_created_at")
    private LocalDateTime createdAt;

    @Column(name = "dispute_resolved_by", length = 50)
    private String resolvedBy;

    @Column(name = "dispute_resolution", columnDefinition = "text")
    private String resolution;

    @Column(name = "dispute_resolved_at")
    private LocalDateTime resolvedAt;

    public boolean isActive() {
        return Boolean.TRUE.equals(isDisputed) && status != null && status.isActive();
    }

    void open(String reason, String description, List<String> evidence, LocalDateTime now) {
        if (isActive()) {
            throw new InvalidStatusException("A dispute is already open for this order");
        }
        this.isDisputed = true;
        this.reason = reason;
        this.description = description;
        this.evidence.clear();
        if (evidence != null) {
            this.evidence.addAll(evidence);
        }
        this.status = DisputeStatus.OPEN;
        this.createdAt = now;
        this.resolvedBy = null;
        this.resolution = null;
        this.resolvedAt = null;
    }

    void startReview() {
        if (status != DisputeStatus.OPEN) {
            throw new InvalidStatusException("Only open disputes can be taken under review, current status: " + status);
        }
        this.status = DisputeStatus.UNDER_REVIEW;
    }

    void finish(DisputeStatus outcome, String resolution, String resolvedBy, LocalDateTime now) {
        if (!isActive()) {
            throw new InvalidStatusException("Dispute is not open, current status: " + status);
        }
        this.status = outcome;
        this.resolution = resolution;
        this.resolvedBy = resolvedBy;
        this.resolvedAt = now;
    }
}
