package se.bazaar_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.bazaar_be.pojo.enums.DocumentType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRequest {
    @NotNull(message = "Document type is required")
    private DocumentType type;

    @NotBlank(message = "Document URL is required")
    private String url;
}
