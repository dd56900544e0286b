package se.bazaar_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.bazaar_be.pojo.enums.BusinessType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SellerApplicationRequest {
    @NotBlank(message = "Business name is required")
    @Size(max = 150, message = "Business name cannot exceed 150 characters")
    private String businessName;

    @NotNull(message = "Business type is required")
    private BusinessType businessType;

    @Size(max = 1000, message = "Description cannot exceed 1000 characters")
    private String description;
}
