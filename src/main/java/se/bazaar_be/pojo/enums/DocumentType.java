package se.bazaar_be.pojo.enums;

public enum DocumentType {
    TRADE_LICENSE,
    TAX_CERTIFICATE,
    IDENTITY_PROOF,
    CELEBRITY_VERIFICATION,
    BRAND_AUTHORIZATION
}
