package com.flamingo.ndthub.api.rest;

import com.flamingo.ndthub.api.auth.AdminOnly;
import com.flamingo.ndthub.api.dto.response.AuditLogResponse;
import com.flamingo.ndthub.domain.entity.AuditLog;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.repository.UserRepository;
import com.flamingo.ndthub.service.audit.AuditService;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for reading the audit trail. */
@RestController
@RequestMapping("/api/audit-logs")
@RequiredArgsConstructor
@AdminOnly
public class AuditLogController {

  private final AuditService auditService;
  private final UserRepository userRepository;

  /** Gets the most recent audit entries with the username of each actor. */
  @GetMapping
  public ResponseEntity<List<AuditLogResponse>> getAuditLogs(
      @RequestParam(value = "limit", required = false) Integer limit) {
    List<AuditLog> entries = auditService.getRecent(limit);

    List<Long> userIds =
        entries.stream().map(AuditLog::getUserId).filter(Objects::nonNull).distinct().toList();
    Map<Long, String> usernames =
        userRepository.findAllById(userIds).stream()
            .collect(Collectors.toMap(User::getId, User::getUsername, (a, b) -> a));

    return ResponseEntity.ok(
        entries.stream()
            .map(entry -> AuditLogResponse.fromEntity(entry, usernames.get(entry.getUserId())))
            .toList());
  }
}
