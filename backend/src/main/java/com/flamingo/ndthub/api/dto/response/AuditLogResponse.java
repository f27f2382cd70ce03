package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.domain.entity.AuditLog;
import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.domain.enums.UserRole;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an audit trail entry. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogResponse {

  private Long id;
  private Long userId;
  private String username;
  private UserRole role;
  private AuditAction actionType;
  private Long manufacturerId;
  private Long documentId;
  private Long sectionId;
  private String metadataJson;
  private LocalDateTime createdAt;

  public static AuditLogResponse fromEntity(AuditLog entry, String username) {
    return AuditLogResponse.builder()
        .id(entry.getId())
        .userId(entry.getUserId())
        .username(username)
        .role(entry.getRole())
        .actionType(entry.getActionType())
        .manufacturerId(entry.getManufacturerId())
        .documentId(entry.getDocumentId())
        .sectionId(entry.getSectionId())
        .metadataJson(entry.getMetadataJson())
        .createdAt(entry.getCreatedAt())
        .build();
  }
}
