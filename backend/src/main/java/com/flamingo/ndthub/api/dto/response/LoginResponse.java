package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.service.auth.LoginResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a successful login. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

  private String token;
  private UserResponse user;

  public static LoginResponse from(LoginResult result) {
    return LoginResponse.builder()
        .token(result.token())
        .user(UserResponse.fromEntity(result.user()))
        .build();
  }
}
