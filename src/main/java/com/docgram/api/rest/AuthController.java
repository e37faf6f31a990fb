package com.docgram.api.rest;

import com.docgram.api.dto.request.LoginRequest;
import com.docgram.api.dto.request.RegisterRequest;
import com.docgram.api.dto.response.TokenResponse;
import com.docgram.security.JwtService;
import com.docgram.service.auth.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for registration and login. These endpoints need no token. */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

  private final AuthService authService;
  private final JwtService jwtService;

  @PostMapping("/register")
  public ResponseEntity<TokenResponse> register(@Valid @RequestBody RegisterRequest request) {
    return ResponseEntity.ok(
        TokenResponse.from(authService.register(request), jwtService.getTokenTtlSeconds()));
  }

  @PostMapping("/login")
  public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
    return ResponseEntity.ok(
        TokenResponse.from(authService.login(request), jwtService.getTokenTtlSeconds()));
  }
}
