package se.bazaar_be.pojo.enums;

public enum DisputeStatus {
    OPEN,
    UNDER_REVIEW,
    RESOLVED,
    CLOSED;

    /**
     * An active dispute suspends auto-release and is the only kind an admin may resolve.
     */
    public boolean isActive() {
        return this == OPEN || this == UNDER_REVIEW;
    }
}
