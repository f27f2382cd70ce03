package com.flamingo.ndthub.api.dto.request;

import com.flamingo.ndthub.domain.enums.UserRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a user. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserRequest {

  @NotBlank(message = "Username is required")
  @Size(max = 100, message = "Username must be at most 100 characters")
  private String username;

  @NotBlank(message = "Password is required")
  private String password;

  private UserRole role;

  private Boolean isActive;
}
