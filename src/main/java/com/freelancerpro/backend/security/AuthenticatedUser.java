package com.freelancerpro.backend.security;

import java.util.UUID;

/**
 * Principal placed in the security context once a bearer token has been verified.
 */
public record AuthenticatedUser(UUID id, String email) {
}
