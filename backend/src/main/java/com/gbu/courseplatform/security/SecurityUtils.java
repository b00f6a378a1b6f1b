package com.gbu.courseplatform.security;

import com.gbu.courseplatform.exception.UnauthenticatedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Reads the caller from the security context. Used only at the controller
 * edge; services receive the {@link AuthenticatedUser} as a parameter.
 */
@Component
public class SecurityUtils {

    public AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return user;
        }
        throw new UnauthenticatedException("Authentication required");
    }
}
