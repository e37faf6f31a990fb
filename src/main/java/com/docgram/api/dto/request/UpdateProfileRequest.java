package com.docgram.api.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial profile update; null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileRequest {

  @Size(min = 3, max = 30, message = "Username must be between 3 and 30 characters")
  private String username;

  @Email(message = "Email must be valid")
  private String email;

  @Size(max = 30, message = "First name must be at most 30 characters")
  private String firstName;

  @Size(max = 30, message = "Last name must be at most 30 characters")
  private String lastName;

  @Size(max = 500, message = "Bio must be at most 500 characters")
  private String bio;

  @Size(max = 500, message = "Avatar URL must be at most 500 characters")
  private String avatarUrl;
}
