package com.realtyhub.backend.modules.auth.domain;

/**
 * Closed role set ordered by privilege: USER &lt; ADMIN &lt; SUPER_ADMIN.
 */
public enum UserRole {
    USER(0),
    ADMIN(1),
    SUPER_ADMIN(2);

    private final int rank;

    UserRole(int rank) {
        this.rank = rank;
    }

    public boolean isAtLeast(UserRole other) {
        return rank >= other.rank;
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
