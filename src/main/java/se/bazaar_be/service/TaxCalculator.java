package se.bazaar_be.service;

import se.bazaar_be.pojo.ShippingAddress;

import java.math.BigDecimal;

/**
 * Tax applied to an order at creation time. Replace the default bean to plug in a real tax table.
 */
public interface TaxCalculator {

    BigDecimal calculateTax(BigDecimal subtotal, ShippingAddress shippingAddress);
}
