package se.bazaar_be.pojo.enums;

import java.util.EnumSet;
import java.util.Set;

public enum VerificationStatus {
    PENDING,
    UNDER_REVIEW,
    VERIFIED,
    REJECTED;

    public Set<VerificationStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(UNDER_REVIEW);
            case UNDER_REVIEW -> EnumSet.of(VERIFIED, REJECTED);
            // a rejected seller may be taken back into review after uploading new documents
            case REJECTED -> EnumSet.of(UNDER_REVIEW);
            case VERIFIED -> EnumSet.noneOf(VerificationStatus.class);
        };
    }

    public boolean canTransitionTo(VerificationStatus target) {
        return allowedTransitions().contains(target);
    }
}
