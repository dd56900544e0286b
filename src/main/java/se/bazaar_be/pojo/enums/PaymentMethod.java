package se.bazaar_be.pojo.enums;

public enum PaymentMethod {
    STRIPE,
    SSLCOMMERZ,
    BKASH,
    NAGAD,
    ROCKET,
    BANK_TRANSFER
}
