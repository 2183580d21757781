package com.freelancerpro.backend.security;

import java.util.UUID;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import com.freelancerpro.backend.exceptions.UnauthorizedException;

@Component
public class CurrentUserService {

    public UUID requireCurrentUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || !(auth.getPrincipal() instanceof AuthenticatedUser user)) {
            throw new UnauthorizedException("User not authenticated");
        }
        return user.id();
    }
}
