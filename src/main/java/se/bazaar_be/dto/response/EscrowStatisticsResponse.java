package se.bazaar_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Platform-wide escrow figures for the admin dashboard. Rates are percentages with two decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowStatisticsResponse {
    private long totalOrders;
    private long deliveredOrders;
    private long escrowHeld;
    private BigDecimal heldAmount;
    private long releasedToSeller;
    private long refundedToCustomer;
    private long refundedOrders;
    private BigDecimal refundRate;
    private long activeDisputes;
    private String currency;
}
