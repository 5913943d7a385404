/**
 * Configuration class for Spring Security settings
 *
 * Features:
 * - Restricts /admin/** to the ADMIN role
 * - Leaves /api/profile-picture/** open at the filter level; the upload pipeline and
 *   controllers reject unauthenticated callers themselves
 * - Sets up stateless HTTP Basic Authentication with a ProblemDetail entry point
 * - Defines in-memory user details for admin and user roles
 */
package net.profilemedia.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.util.StringUtils;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    private final CustomBasicAuthenticationEntryPoint customBasicAuthenticationEntryPoint;
    private final Environment environment;

    public SecurityConfig(CustomBasicAuthenticationEntryPoint customBasicAuthenticationEntryPoint,
                          Environment environment) {
        this.customBasicAuthenticationEntryPoint = customBasicAuthenticationEntryPoint;
        this.environment = environment;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .authorizeHttpRequests(authorizeRequests ->
                authorizeRequests
                    .requestMatchers("/admin/**").hasRole("ADMIN")
                    .requestMatchers("/actuator/health/**", "/actuator/health").permitAll()
                    .requestMatchers("/actuator/**").hasRole("ADMIN")
                    .anyRequest().permitAll()
            )
            .httpBasic(httpBasic -> httpBasic.authenticationEntryPoint(customBasicAuthenticationEntryPoint))
            // Credentials travel on every request; no session cookie is ever issued
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .csrf(csrf -> csrf.disable());
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder passwordEncoder) {
        String adminUsername = resolveUsername("app.security.admin.username", "admin");
        String userUsername = resolveUsername("app.security.user.username", "user");
        String adminPassword = resolvePassword("app.security.admin.password");
        String userPassword = resolvePassword("app.security.user.password");

        InMemoryUserDetailsManager userDetailsManager = new InMemoryUserDetailsManager();

        if (adminPassword != null) {
            UserDetails admin = User.builder()
                .username(adminUsername)
                .password(passwordEncoder.encode(adminPassword))
                .roles("ADMIN", "USER")
                .build();
            userDetailsManager.createUser(admin);
        } else {
            log.error("Admin endpoints disabled: missing app.security.admin.password. Set the secret to re-enable /admin/**.");
        }

        if (userPassword != null) {
            UserDetails regularUser = User.builder()
                .username(userUsername)
                .password(passwordEncoder.encode(userPassword))
                .roles("USER")
                .build();
            userDetailsManager.createUser(regularUser);
        } else {
            log.warn("Basic auth user account disabled: missing app.security.user.password. Profile picture uploads will be rejected until configured.");
        }

        return userDetailsManager;
    }

    private String resolvePassword(String propertyKey) {
        String value = environment.getProperty(propertyKey);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        return value.trim();
    }

    private String resolveUsername(String propertyKey, String defaultValue) {
        String value = environment.getProperty(propertyKey);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        return value.trim();
    }
}
