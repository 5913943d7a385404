package net.profilemedia.auth;

import org.springframework.lang.Nullable;

/**
 * Result of a session liveness check.
 *
 * @param error why no usable session exists, {@code null} when the session is valid
 */
public record SessionStatus(@Nullable String error) {

    private static final SessionStatus ACTIVE = new SessionStatus(null);

    public static SessionStatus active() {
        return ACTIVE;
    }

    public static SessionStatus failed(String error) {
        return new SessionStatus(error == null ? "Unknown session error" : error);
    }

    public boolean isActive() {
        return error == null;
    }
}
