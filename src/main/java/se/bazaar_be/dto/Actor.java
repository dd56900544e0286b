package se.bazaar_be.dto;

import lombok.AllArgsConstructor;
import lombok.Value;
import se.bazaar_be.pojo.enums.Role;

/**
 * Authenticated caller as resolved by the upstream gateway.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class Actor {

    public static final Actor SYSTEM = Actor.of(null, Role.SYSTEM);

    Long userId;
    Role role;

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isSystem() {
        return role == Role.SYSTEM;
    }

    /**
     * Value written to audit fields such as {@code releasedBy}.
     */
    public String label() {
        return isSystem() ? "system" : String.valueOf(userId);
    }
}
