package com.flamingo.ndthub.api.dto.request;

import com.flamingo.ndthub.domain.enums.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a partial user update. Absent fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUserRequest {

  private UserRole role;
  private String password;
  private Boolean isActive;
}
