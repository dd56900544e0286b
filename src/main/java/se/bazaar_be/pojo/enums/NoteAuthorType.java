package se.bazaar_be.pojo.enums;

public enum NoteAuthorType {
    CUSTOMER,
    SELLER,
    ADMIN,
    SYSTEM
}
