package se.bazaar_be.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.bazaar_be.pojo.enums.TrustBadge;
import se.bazaar_be.pojo.enums.VerificationStatus;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationUpdateRequest {
    @NotNull(message = "Verification status is required")
    private VerificationStatus status;

    private String notes;

    private List<TrustBadge> trustBadges;

    // required when status is REJECTED
    private String rejectionReason;
}
