package com.example.vidstream.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import javax.crypto.SecretKey;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JwtService Tests")
class JwtServiceTest {

    private final String base64Secret = Base64.getEncoder().encodeToString("TestSecretKeyMustBeAtLeast32BytesLongForHS256".getBytes());
    private final String issuer = "TestIssuer";
    private final String caller = "viewer-17";
    private SecretKey key;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        key = Keys.hmacShaKeyFor(Base64.getDecoder().decode(base64Secret));
        jwtService = new JwtService(base64Secret, issuer);
        initializeJwtService(jwtService);
    }

    private void initializeJwtService(JwtService service) {
        try {
            Method initMethod = JwtService.class.getDeclaredMethod("initializeKey");
            initMethod.setAccessible(true);
            initMethod.invoke(service);
        } catch (InvocationTargetException ite) {
            if (ite.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException("Failed to initialize key via reflection", ite.getCause());
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Failed to initialize key via reflection", e);
        }
    }

    private String token(String subject, String tokenIssuer, SecretKey signingKey, Instant expiresAt) {
        return Jwts.builder()
                .subject(subject)
                .issuer(tokenIssuer)
                .issuedAt(Date.from(Instant.now().minusSeconds(5)))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey)
                .compact();
    }

    private String validToken() {
        return token(caller, issuer, key, Instant.now().plus(Duration.ofHours(1)));
    }

    @Nested
    @DisplayName("Initialization")
    class InitializationTests {

        @Test
        @DisplayName("❌ Should reject a missing secret")
        void initialization_MissingSecret() {
            JwtService service = new JwtService(null, issuer);
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> initializeJwtService(service))
                    .withMessageContaining("must be provided");
        }

        @Test
        @DisplayName("❌ Should reject a secret shorter than 256 bits")
        void initialization_ShortSecret() {
            JwtService service = new JwtService(Base64.getEncoder().encodeToString("too-short".getBytes()), issuer);
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> initializeJwtService(service))
                    .withMessageContaining("at least 256 bits");
        }

        @Test
        @DisplayName("❌ Should reject a blank issuer")
        void initialization_BlankIssuer() {
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> new JwtService(base64Secret, " "))
                    .withMessageContaining("jwt.issuer");
        }
    }

    @Nested
    @DisplayName("validateTokenAndGetCaller()")
    class ValidationTests {

        @Test
        @DisplayName("✅ Should accept a bearer token from the Authorization header")
        void validate_BearerHeader() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Authorization", JwtService.PREFIX + validToken());

            assertThat(jwtService.validateTokenAndGetCaller(request)).isEqualTo(caller);
        }

        @Test
        @DisplayName("✅ Should fall back to the access token cookie sent by players")
        void validate_Cookie() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.setCookies(new Cookie(JwtService.ACCESS_TOKEN_COOKIE_NAME, validToken()));

            assertThat(jwtService.validateTokenAndGetCaller(request)).isEqualTo(caller);
        }

        @Test
        @DisplayName("⚠️ Should return null when no token is present")
        void validate_NoToken() {
            assertThat(jwtService.validateTokenAndGetCaller(new MockHttpServletRequest())).isNull();
        }

        @Test
        @DisplayName("❌ Should reject a token from another issuer")
        void validate_WrongIssuer() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Authorization",
                    JwtService.PREFIX + token(caller, "SomeoneElse", key, Instant.now().plusSeconds(600)));

            assertThat(jwtService.validateTokenAndGetCaller(request)).isNull();
        }

        @Test
        @DisplayName("❌ Should reject an expired token")
        void validate_Expired() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Authorization",
                    JwtService.PREFIX + token(caller, issuer, key, Instant.now().minusSeconds(600)));

            assertThat(jwtService.validateTokenAndGetCaller(request)).isNull();
        }

        @Test
        @DisplayName("❌ Should reject a token signed with a different key")
        void validate_WrongSignature() {
            SecretKey otherKey = Keys.hmacShaKeyFor("AnotherSecretKeyThatIsAlsoLongEnoughForHS256!".getBytes());
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Authorization",
                    JwtService.PREFIX + token(caller, issuer, otherKey, Instant.now().plusSeconds(600)));

            assertThat(jwtService.validateTokenAndGetCaller(request)).isNull();
        }

        @Test
        @DisplayName("❌ Should reject garbage")
        void validate_Malformed() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Authorization", JwtService.PREFIX + "not.a.jwt");

            assertThat(jwtService.validateTokenAndGetCaller(request)).isNull();
        }
    }
}
