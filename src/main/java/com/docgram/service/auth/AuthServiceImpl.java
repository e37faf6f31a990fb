package com.docgram.service.auth;

import com.docgram.api.dto.request.LoginRequest;
import com.docgram.api.dto.request.RegisterRequest;
import com.docgram.domain.entity.User;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.InvalidInputException;
import com.docgram.exception.UnauthorizedException;
import com.docgram.security.JwtService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the AuthService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthServiceImpl implements AuthService {

  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;
  private final JwtService jwtService;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "auth.register", description = "Time to register an account")
  public AuthResult register(RegisterRequest request) {
    String username = request.getUsername().trim();
    String email = request.getEmail().trim();

    if (userRepository.existsByUsername(username)) {
      throw new InvalidInputException("Username already registered");
    }
    if (userRepository.existsByEmail(email)) {
      throw new InvalidInputException("Email already registered");
    }

    User user =
        User.builder()
            .username(username)
            .email(email)
            .passwordHash(passwordEncoder.encode(request.getPassword()))
            .firstName(request.getFirstName())
            .lastName(request.getLastName())
            .bio(request.getBio())
            .build();
    User saved = userRepository.save(user);

    meterRegistry.counter("auth.registered").increment();
    log.info("Registered user {} ({})", saved.getUsername(), saved.getId());
    return new AuthResult(jwtService.issueToken(saved.getId()), saved);
  }

  @Override
  @Transactional
  @Timed(value = "auth.login", description = "Time to log in")
  public AuthResult login(LoginRequest request) {
    String identifier = request.getUsernameOrEmail().trim();
    Optional<User> candidate = userRepository.findByUsername(identifier);
    if (candidate.isEmpty()) {
      candidate = userRepository.findByEmail(identifier);
    }

    User user =
        candidate
            .filter(u -> passwordEncoder.matches(request.getPassword(), u.getPasswordHash()))
            .orElseThrow(
                () -> {
                  meterRegistry.counter("auth.login.failure").increment();
                  return new UnauthorizedException("Incorrect username/email or password");
                });
    if (!user.isActive()) {
      throw new InvalidInputException("Inactive user");
    }

    user.setLastLoginAt(LocalDateTime.now());
    userRepository.save(user);

    meterRegistry.counter("auth.login.success").increment();
    log.info("User {} logged in", user.getId());
    return new AuthResult(jwtService.issueToken(user.getId()), user);
  }
}
