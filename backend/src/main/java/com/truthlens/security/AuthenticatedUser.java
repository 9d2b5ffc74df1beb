package com.truthlens.security;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Reads the user ID placed in the authentication by {@link JwtTokenProvider}.
 */
public final class AuthenticatedUser {

    private AuthenticatedUser() {
    }

    public static UUID idOf(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated user");
        }
        return UUID.fromString(authentication.getName());
    }
}
