package com.docgram.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docgram.config.DocgramProperties;
import com.docgram.exception.UnauthorizedException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JwtService Tests")
class JwtServiceTest {

  private static final String SECRET = "unit-test-secret-unit-test-secret-0123";

  private JwtService jwtService;

  @BeforeEach
  void setUp() {
    jwtService = new JwtService(properties(SECRET));
  }

  @Test
  void shouldReturnUserId_forTokenItIssued() {
    UUID userId = UUID.randomUUID();

    assertThat(jwtService.verify(jwtService.issueToken(userId))).isEqualTo(userId);
  }

  @Test
  void shouldExposeTtlInSeconds() {
    assertThat(jwtService.getTokenTtlSeconds()).isEqualTo(30L * 24 * 60 * 60);
  }

  @Test
  void shouldRejectExpiredToken() {
    // Given
    Instant past = Instant.now().minus(2, ChronoUnit.DAYS);
    String expired =
        Jwts.builder()
            .subject(UUID.randomUUID().toString())
            .issuedAt(Date.from(past))
            .expiration(Date.from(past.plus(1, ChronoUnit.HOURS)))
            .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
            .compact();

    // When / Then
    assertThatThrownBy(() -> jwtService.verify(expired))
        .isInstanceOf(UnauthorizedException.class)
        .hasMessage("Could not validate credentials");
  }

  @Test
  void shouldRejectTokenSignedWithAnotherSecret() {
    JwtService other = new JwtService(properties("another-secret-another-secret-987654"));

    assertThatThrownBy(() -> jwtService.verify(other.issueToken(UUID.randomUUID())))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void shouldRejectGarbage() {
    assertThatThrownBy(() -> jwtService.verify("not.a.jwt"))
        .isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> jwtService.verify(""))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void shouldRejectSignedToken_withoutSubject() {
    String token =
        Jwts.builder()
            .issuedAt(new Date())
            .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
            .compact();

    assertThatThrownBy(() -> jwtService.verify(token))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void shouldRejectSubjectThatIsNotAUserId() {
    String token =
        Jwts.builder()
            .subject("admin")
            .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
            .compact();

    assertThatThrownBy(() -> jwtService.verify(token)).isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void shouldRefuseToStart_withShortSecret() {
    assertThatThrownBy(() -> new JwtService(properties("short")))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> new JwtService(properties(null)))
        .isInstanceOf(IllegalStateException.class);
  }

  private static DocgramProperties properties(String secret) {
    DocgramProperties properties = new DocgramProperties();
    properties.getSecurity().setJwtSecret(secret);
    return properties;
  }
}
