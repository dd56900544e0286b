package se.bazaar_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomerFeedback {

    @Column(name = "feedback_rating")
    private Integer rating;

    @Column(name = "feedback_review", columnDefinition = "text")
    private String review;

    @Column(name = "feedback_reviewed_at")
    private LocalDateTime reviewedAt;

    @Column(name = "feedback_verified_purchase", nullable = false)
    @Builder.Default
    private Boolean isVerifiedPurchase = true;

    public boolean isSubmitted() {
        return reviewedAt != null;
    }
}
