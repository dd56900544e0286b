package se.bazaar_be.service;

import org.springframework.stereotype.Component;
import se.bazaar_be.pojo.ShippingAddress;

import java.math.BigDecimal;

@Component
public class NoTaxCalculator implements TaxCalculator {

    @Override
    public BigDecimal calculateTax(BigDecimal subtotal, ShippingAddress shippingAddress) {
        return BigDecimal.ZERO;
    }
}
