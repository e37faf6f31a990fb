package com.docgram.api.dto.response;

import com.docgram.service.auth.AuthResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a successful register or login. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

  private String accessToken;
  @Builder.Default private String tokenType = "bearer";
  private long expiresIn;
  private UserResponse user;

  public static TokenResponse from(AuthResult result, long expiresInSeconds) {
    return TokenResponse.builder()
        .accessToken(result.accessToken())
        .expiresIn(expiresInSeconds)
        .user(UserResponse.fromOwnAccount(result.user()))
        .build();
  }
}
