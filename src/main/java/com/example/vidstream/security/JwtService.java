package com.example.vidstream.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * Verifies access tokens issued by the external auth service.
 * Tokens are read from the {@code Authorization: Bearer} header, falling back to the {@code access_token} cookie
 * that browser players send. Issuance, refresh and revocation live in the auth service.
 */
@Component
public class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    public static final String PREFIX = "Bearer ";
    public static final String ACCESS_TOKEN_COOKIE_NAME = "access_token";

    private SecretKey key;
    private final String base64Secret;
    private final String issuer;

    public JwtService(
            @Value("${jwt.secret.key.base64}") String base64Secret,
            @Value("${jwt.issuer}") String issuer) {

        this.base64Secret = base64Secret;

        if (issuer == null || issuer.trim().isEmpty()) {
            throw new IllegalArgumentException("JWT Issuer (jwt.issuer) must not be null or empty");
        }
        this.issuer = issuer;
        log.info("JWT Service Initializing. Expected issuer: {}", issuer);
    }

    @PostConstruct
    private void initializeKey() {
        log.debug("Attempting to initialize JWT Key from property/environment variable.");
        if (!StringUtils.hasText(this.base64Secret)) {
            log.error("CRITICAL: JWT Secret Key (jwt.secret.key.base64 or JWT_SECRET_KEY_BASE64 env var) is missing or empty!");
            throw new IllegalArgumentException("JWT Secret Key (jwt.secret.key.base64) must be provided via properties or environment variable (JWT_SECRET_KEY_BASE64)");
        }

        byte[] decodedKey;
        try {
            decodedKey = Base64.getDecoder().decode(this.base64Secret);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Base64 encoding for JWT secret key (jwt.secret.key.base64)", e);
        }
        if (decodedKey.length < 32) {
            log.error("CRITICAL: Provided JWT secret key is too short ({} bytes). Must be at least 256 bits (32 bytes).", decodedKey.length);
            throw new IllegalArgumentException("JWT Secret key must be at least 256 bits (32 bytes)");
        }
        this.key = Keys.hmacShaKeyFor(decodedKey);
        log.info("JWT Secret Key initialized successfully.");
    }

    /**
     * Validates the access token carried by the request.
     *
     * @param request The incoming HttpServletRequest.
     * @return The caller (token subject) if the token is present, correctly signed, unexpired and from the
     * expected issuer; null otherwise.
     */
    public String validateTokenAndGetCaller(HttpServletRequest request) {
        Optional<String> tokenOpt = extractToken(request);
        if (tokenOpt.isEmpty()) {
            log.debug("No access token on request.");
            return null;
        }

        try {
            Claims claims = Jwts.parser()
                    .verifyWith(this.key)
                    .requireIssuer(this.issuer)
                    .build()
                    .parseSignedClaims(tokenOpt.get())
                    .getPayload();

            String subject = claims.getSubject();
            if (!StringUtils.hasText(subject)) {
                log.warn("Access token has no subject.");
                return null;
            }
            log.debug("Access token validated for caller: {}", subject);
            return subject;

        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return null;
        } catch (IllegalArgumentException e) {
            log.warn("Invalid token format or claim issue: {}", e.getMessage());
            return null;
        }
    }

    private Optional<String> extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(PREFIX)) {
            return Optional.of(header.substring(PREFIX.length()));
        }
        if (request.getCookies() != null) {
            return Arrays.stream(request.getCookies())
                    .filter(c -> ACCESS_TOKEN_COOKIE_NAME.equals(c.getName()))
                    .map(Cookie::getValue)
                    .filter(StringUtils::hasText)
                    .findFirst();
        }
        return Optional.empty();
    }
}
