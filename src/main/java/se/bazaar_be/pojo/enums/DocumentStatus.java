package se.bazaar_be.pojo.enums;

public enum DocumentStatus {
    PENDING,
    APPROVED,
    REJECTED
}
