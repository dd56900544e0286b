package se.bazaar_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenDisputeRequest {
    @NotBlank(message = "Dispute reason is required")
    private String reason;

    private String description;

    // URLs of uploaded evidence files
    private List<String> evidence;
}
