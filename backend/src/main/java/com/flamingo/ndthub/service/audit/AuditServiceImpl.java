package com.flamingo.ndthub.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ndthub.config.HubConfig;
import com.flamingo.ndthub.domain.entity.AuditLog;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.domain.repository.AuditLogRepository;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the AuditService backed by the audit_logs table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditServiceImpl implements AuditService {

  private final AuditLogRepository auditLogRepository;
  private final ObjectMapper objectMapper;
  private final HubConfig hubConfig;

  @Override
  @Transactional
  public AuditLog record(
      User actor, AuditAction action, AuditTarget target, Map<String, ?> metadata) {
    AuditLog entry =
        AuditLog.builder()
            .userId(actor.getId())
            .role(actor.getRole())
            .actionType(action)
            .manufacturerId(target.manufacturerId())
            .documentId(target.documentId())
            .sectionId(target.sectionId())
            .metadataJson(toJson(metadata))
            .build();
    AuditLog saved = auditLogRepository.save(entry);
    log.debug("Audit {} by user {} on {}", action, actor.getUsername(), target);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditLog> getRecent(Integer limit) {
    HubConfig.Audit audit = hubConfig.getAudit();
    int size = limit == null || limit <= 0 ? audit.getDefaultLimit() : limit;
    size = Math.min(size, audit.getMaxLimit());
    return auditLogRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, size));
  }

  private String toJson(Map<String, ?> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize audit metadata: {}", e.getMessage());
      return null;
    }
  }
}
