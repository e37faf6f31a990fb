package com.docgram.security;

import com.docgram.config.DocgramProperties;
import com.docgram.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Issues and verifies HS256 bearer tokens carrying the user id as subject. */
@Service
@Slf4j
public class JwtService {

  private static final int MIN_SECRET_BYTES = 32;

  private final SecretKey signingKey;
  private final Duration tokenTtl;

  public JwtService(DocgramProperties properties) {
    String secret = properties.getSecurity().getJwtSecret();
    if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "docgram.security.jwt-secret must be at least 32 bytes. Set JWT_SECRET.");
    }
    this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    this.tokenTtl = Duration.ofDays(properties.getSecurity().getTokenTtlDays());
  }

  public String issueToken(UUID userId) {
    Instant now = Instant.now();
    return Jwts.builder()
        .subject(userId.toString())
        .issuedAt(Date.from(now))
        .expiration(Date.from(now.plus(tokenTtl)))
        .signWith(signingKey)
        .compact();
  }

  /**
   * Verifies a token and returns the user id it was issued for.
   *
   * @throws UnauthorizedException if the token is malformed, tampered with or expired
   */
  public UUID verify(String token) {
    try {
      Claims claims =
          Jwts.parser().verifyWith(signingKey).build().parseSignedClaims(token).getPayload();
      if (claims.getSubject() == null) {
        throw new UnauthorizedException("Could not validate credentials");
      }
      return UUID.fromString(claims.getSubject());
    } catch (JwtException | IllegalArgumentException e) {
      log.debug("Rejected bearer token: {}", e.getMessage());
      throw new UnauthorizedException("Could not validate credentials", e);
    }
  }

  public long getTokenTtlSeconds() {
    return tokenTtl.toSeconds();
  }
}
