package com.bubblegrade.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class SecurityUtils {

    public AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return user;
        }
        throw new IllegalStateException("No authenticated user found in security context");
    }

    /** Opaque account id issued by the accounts service; used as editor / reviewer identity. */
    public String getCurrentUserId() {
        return getCurrentUser().getId();
    }

    public boolean hasRole(String role) {
        return getCurrentUser().getRole().equals(role);
    }

    public boolean isTeacher() {
        return hasRole("TEACHER");
    }
}
