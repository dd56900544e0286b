package se.bazaar_be.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional free text attached to simple order actions (cancel, confirm delivery, close dispute).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderActionRequest {

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    private String notes;
}
