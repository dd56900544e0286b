package se.bazaar_be.configuration;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Values owned by external configuration and consumed by the order and escrow flows.
 */
@Component
@Getter
public class MarketplaceSettings {

    private final int escrowHoldDays;
    private final BigDecimal flatShippingFee;
    private final BigDecimal freeShippingThreshold;
    private final String currency;

    public MarketplaceSettings(@Value("${escrow.hold-days:7}") int escrowHoldDays,
                               @Value("${order.shipping.flat-fee:60}") BigDecimal flatShippingFee,
                               @Value("${order.shipping.free-threshold:1000}") BigDecimal freeShippingThreshold,
                               @Value("${order.currency:BDT}") String currency) {
        this.escrowHoldDays = escrowHoldDays;
        this.flatShippingFee = flatShippingFee;
        this.freeShippingThreshold = freeShippingThreshold;
        this.currency = currency;
    }
}
