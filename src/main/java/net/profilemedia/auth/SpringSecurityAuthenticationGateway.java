package net.profilemedia.auth;

import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.context.SecurityContextHolderStrategy;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the session and principal from the Spring Security context of the calling thread.
 *
 * <p>The upload pipeline runs on a Reactor worker thread, so callers must capture the
 * authentication before switching schedulers; see
 * {@link net.profilemedia.service.media.ProfilePictureUploadService}.</p>
 */
@Component
public class SpringSecurityAuthenticationGateway implements AuthenticationGateway {

    private static final Logger log = LoggerFactory.getLogger(SpringSecurityAuthenticationGateway.class);
    private static final String ROLE_PREFIX = "ROLE_";

    private final SecurityContextHolderStrategy securityContextHolderStrategy;

    public SpringSecurityAuthenticationGateway() {
        this(SecurityContextHolder.getContextHolderStrategy());
    }

    SpringSecurityAuthenticationGateway(SecurityContextHolderStrategy securityContextHolderStrategy) {
        this.securityContextHolderStrategy = securityContextHolderStrategy;
    }

    @Override
    public SessionStatus getSession() {
        Authentication authentication = securityContextHolderStrategy.getContext().getAuthentication();
        if (authentication == null) {
            return SessionStatus.failed("No active session");
        }
        if (authentication instanceof AnonymousAuthenticationToken) {
            return SessionStatus.failed("Anonymous session");
        }
        if (!authentication.isAuthenticated()) {
            return SessionStatus.failed("Session is not authenticated");
        }
        return SessionStatus.active();
    }

    @Override
    public Optional<AuthenticatedUser> getCurrentUser() {
        if (!getSession().isActive()) {
            return Optional.empty();
        }
        Authentication authentication = securityContextHolderStrategy.getContext().getAuthentication();
        String name = authentication.getName();
        if (!StringUtils.hasText(name)) {
            log.warn("Authenticated session carries a blank principal name; treating as unauthenticated");
            return Optional.empty();
        }
        return Optional.of(new AuthenticatedUser(
            name,
            authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .filter(authority -> authority != null && authority.startsWith(ROLE_PREFIX))
                .map(authority -> authority.substring(ROLE_PREFIX.length()))
                .collect(Collectors.toSet())
        ));
    }
}
