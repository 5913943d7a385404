package net.profilemedia.auth;

import java.util.Objects;
import java.util.Set;

/**
 * Authenticated principal.
 *
 * @param id owner identifier used in storage keys
 * @param roles granted role names without the {@code ROLE_} prefix
 */
public record AuthenticatedUser(String id, Set<String> roles) {

    public AuthenticatedUser {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Principal id must not be blank");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }
}
