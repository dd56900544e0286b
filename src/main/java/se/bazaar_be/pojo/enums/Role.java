package se.bazaar_be.pojo.enums;

public enum Role {
    CUSTOMER,
    SELLER,
    ADMIN,
    SYSTEM
}
