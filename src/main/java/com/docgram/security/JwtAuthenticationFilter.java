package com.docgram.security;

import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.ApiError;
import com.docgram.exception.UnauthorizedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Requires a valid bearer token on every request outside the public paths.
 *
 * <p>On success the authenticated user id is exposed as the request attribute {@link
 * #USER_ID_ATTRIBUTE}; otherwise the request ends with 401 and an {@link ApiError} body.
 */
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  public static final String USER_ID_ATTRIBUTE = "docgram.userId";

  private static final String BEARER_PREFIX = "Bearer ";
  private static final List<String> PUBLIC_PREFIXES = List.of("/auth/", "/actuator/health");

  private final JwtService jwtService;
  private final UserRepository userRepository;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if (HttpMethod.OPTIONS.matches(request.getMethod())) {
      return true;
    }
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return PUBLIC_PREFIXES.stream().anyMatch(path::startsWith);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    UUID userId;
    try {
      userId = authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
    } catch (UnauthorizedException e) {
      reject(request, response, e.getMessage());
      return;
    }
    request.setAttribute(USER_ID_ATTRIBUTE, userId);
    chain.doFilter(request, response);
  }

  private UUID authenticate(String header) {
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      throw new UnauthorizedException("Not authenticated");
    }
    UUID userId = jwtService.verify(header.substring(BEARER_PREFIX.length()).trim());
    if (!userRepository.existsById(userId)) {
      throw new UnauthorizedException("Could not validate credentials");
    }
    return userId;
  }

  private void reject(HttpServletRequest request, HttpServletResponse response, String message)
      throws IOException {
    meterRegistry.counter("api_errors_total", "error_type", "unauthorized").increment();
    String errorId = UUID.randomUUID().toString().substring(0, 8);
    log.warn(
        "Unauthorized [{}] {} {}: {}",
        errorId,
        request.getMethod(),
        request.getRequestURI(),
        message);

    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    ApiError body =
        ApiError.builder()
            .errorId(errorId)
            .code(ApiError.UNAUTHORIZED)
            .message(message)
            .path(request.getRequestURI())
            .timestamp(Instant.now())
            .build();
    response.getWriter().write(objectMapper.writeValueAsString(body));
  }
}
