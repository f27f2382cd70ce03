package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.UserRole;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for user data. Never carries the password hash. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

  private Long id;
  private String username;
  private UserRole role;
  private Boolean isActive;
  private LocalDateTime createdAt;

  public static UserResponse fromEntity(User user) {
    return UserResponse.builder()
        .id(user.getId())
        .username(user.getUsername())
        .role(user.getRole())
        .isActive(user.isActive())
        .createdAt(user.getCreatedAt())
        .build();
  }
}
