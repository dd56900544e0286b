package se.bazaar_be.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveDisputeRequest {
    @NotBlank(message = "Resolution is required")
    private String resolution;

    @DecimalMin(value = "0.0", message = "Refund amount cannot be negative")
    private BigDecimal refundAmount;

    private String adminNotes;
}
