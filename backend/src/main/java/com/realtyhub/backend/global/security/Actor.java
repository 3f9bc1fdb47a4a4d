package com.realtyhub.backend.global.security;

import java.util.UUID;

import com.realtyhub.backend.modules.auth.domain.UserRole;

/**
 * Caller identity handed to services. Anonymous callers have neither id nor role.
 */
public record Actor(UUID userId, UserRole role) {

    private static final Actor ANONYMOUS = new Actor(null, null);

    public static Actor anonymous() {
        return ANONYMOUS;
    }

    public static Actor of(UUID userId, UserRole role) {
        return new Actor(userId, role);
    }

    public boolean isAnonymous() {
        return userId == null;
    }

    public boolean isAtLeast(UserRole required) {
        return role != null && role.isAtLeast(required);
    }

    public boolean is(UUID otherUserId) {
        return userId != null && userId.equals(otherUserId);
    }
}
