package com.docgram.service.auth;

import com.docgram.api.dto.request.LoginRequest;
import com.docgram.api.dto.request.RegisterRequest;

/** Service interface for account registration and login. */
public interface AuthService {

  /**
   * Creates an account and signs it in.
   *
   * @throws com.docgram.exception.InvalidInputException if the username or email is taken
   */
  AuthResult register(RegisterRequest request);

  /**
   * Verifies credentials and issues a token.
   *
   * @throws com.docgram.exception.UnauthorizedException if the credentials do not match
   * @throws com.docgram.exception.InvalidInputException if the account is inactive
   */
  AuthResult login(LoginRequest request);
}
