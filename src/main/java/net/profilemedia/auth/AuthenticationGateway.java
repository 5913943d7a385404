package net.profilemedia.auth;

import java.util.Optional;

/**
 * Session and principal lookup used to gate profile picture operations.
 */
public interface AuthenticationGateway {

    /**
     * Checks that an authenticated session is present for the current call.
     */
    SessionStatus getSession();

    /**
     * Resolves the authenticated principal, empty when none exists.
     */
    Optional<AuthenticatedUser> getCurrentUser();
}
