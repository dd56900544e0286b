package se.bazaar_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderListResponse {
    private Long orderId;
    private String orderNumber;
    private Long buyerId;
    private Long sellerId;
    private String status;
    private String escrowStatus;
    private LocalDateTime autoReleaseAt;
    private String disputeStatus;
    private BigDecimal total;
    private String currency;
    private Integer totalItems;
    private Instant createdAt;
}
