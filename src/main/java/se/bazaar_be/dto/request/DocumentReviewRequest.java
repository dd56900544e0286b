package se.bazaar_be.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.bazaar_be.pojo.enums.DocumentStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentReviewRequest {
    @NotNull(message = "Document status is required")
    private DocumentStatus status;
}
