package com.freelancerpro.backend.security;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.Getter;

/**
 * HS256 bearer tokens whose subject is the user id. Issuing is only used for
 * development tokens and tests; requests are authenticated by {@link #parse(String)}.
 */
@Service
public class JwtService {

    private static final String EMAIL_CLAIM = "email";

    @Value("${jwt.secret}")
    private String secret;

    @Getter
    @Value("${jwt.expiration:86400000}")
    private Long expirationMillis;

    public String generateToken(UUID userId, String email) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + expirationMillis);

        return Jwts.builder()
                .setClaims(Map.of(EMAIL_CLAIM, email))
                .setSubject(userId.toString())
                .setIssuedAt(now)
                .setExpiration(expiryDate)
                .signWith(getSigningKey(), SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verifies signature and expiry.
     *
     * @throws io.jsonwebtoken.JwtException when the token is malformed, forged or expired
     * @throws IllegalArgumentException when the subject is not a user id
     */
    public AuthenticatedUser parse(String token) {
        Claims claims = extractAllClaims(token);
        String subject = claims.getSubject();
        if (subject == null) {
            throw new IllegalArgumentException("Token has no subject");
        }
        UUID userId = UUID.fromString(subject);
        return new AuthenticatedUser(userId, claims.get(EMAIL_CLAIM, String.class));
    }

    private Claims extractAllClaims(String token) {
        return Jwts
                .parserBuilder()
                .setSigningKey(getSigningKey())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private Key getSigningKey() {
        // raw string secret, not Base64
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
