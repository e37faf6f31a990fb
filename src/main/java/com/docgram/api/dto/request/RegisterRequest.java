package com.docgram.api.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating an account. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

  @NotBlank(message = "Username is required")
  @Size(min = 3, max = 30, message = "Username must be between 3 and 30 characters")
  private String username;

  @NotBlank(message = "Email is required")
  @Email(message = "Email must be valid")
  private String email;

  @NotBlank(message = "Password is required")
  @Size(min = 6, max = 128, message = "Password must be at least 6 characters")
  private String password;

  @Size(max = 30, message = "First name must be at most 30 characters")
  private String firstName;

  @Size(max = 30, message = "Last name must be at most 30 characters")
  private String lastName;

  @Size(max = 500, message = "Bio must be at most 500 characters")
  private String bio;
}
