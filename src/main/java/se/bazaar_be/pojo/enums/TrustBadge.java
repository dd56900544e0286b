package se.bazaar_be.pojo.enums;

public enum TrustBadge {
    VERIFIED_BRAND,
    CELEBRITY_ENDORSED,
    TOP_RATED,
    FAST_SHIPPING,
    AUTHENTIC_GUARANTEE
}
