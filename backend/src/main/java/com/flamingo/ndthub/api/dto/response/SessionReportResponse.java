package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.domain.entity.SessionToken;
import com.flamingo.ndthub.domain.enums.UserRole;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one row of the session activity report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionReportResponse {

  private Long userId;
  private String username;
  private UserRole role;
  private LocalDateTime createdAt;
  private LocalDateTime lastSeenAt;
  private String lastPath;
  private String ip;
  private String userAgent;
  private long activeSeconds;

  public static SessionReportResponse fromEntity(SessionToken session) {
    return SessionReportResponse.builder()
        .userId(session.getUser().getId())
        .username(session.getUser().getUsername())
        .role(session.getUser().getRole())
        .createdAt(session.getCreatedAt())
        .lastSeenAt(session.getLastSeenAt())
        .lastPath(session.getLastPath())
        .ip(session.getIp())
        .userAgent(session.getUserAgent())
        .activeSeconds(session.activeSeconds())
        .build();
  }
}
