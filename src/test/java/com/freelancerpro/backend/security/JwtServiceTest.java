package com.freelancerpro.backend.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;

class JwtServiceTest {

    private static final String SECRET = "test-secret-key-for-unit-tests-at-least-32-bytes-long";

    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        jwtService = newService(SECRET, 3_600_000L);
    }

    private static JwtService newService(String secret, long expirationMillis) {
        JwtService service = new JwtService();
        ReflectionTestUtils.setField(service, "secret", secret);
        ReflectionTestUtils.setField(service, "expirationMillis", expirationMillis);
        return service;
    }

    @Test
    void parse_issuedToken_yieldsUserIdAndEmail() {
        UUID userId = UUID.randomUUID();
        String token = jwtService.generateToken(userId, "mike@example.com");

        AuthenticatedUser user = jwtService.parse(token);

        assertEquals(userId, user.id());
        assertEquals("mike@example.com", user.email());
    }

    @Test
    void parse_tokenSignedWithAnotherSecret_isRejected() {
        JwtService other = newService("another-secret-key-that-is-also-32-bytes-or-more", 3_600_000L);
        String forged = other.generateToken(UUID.randomUUID(), "eve@example.com");

        assertThrows(JwtException.class, () -> jwtService.parse(forged));
    }

    @Test
    void parse_expiredToken_isRejected() {
        JwtService shortLived = newService(SECRET, -1_000L);
        String expired = shortLived.generateToken(UUID.randomUUID(), "mike@example.com");

        assertThrows(ExpiredJwtException.class, () -> jwtService.parse(expired));
    }

    @Test
    void parse_garbage_isRejected() {
        assertThrows(JwtException.class, () -> jwtService.parse("not.a.jwt"));
    }
}
