package com.flamingo.ndthub.api.rest;

import com.flamingo.ndthub.domain.repository.AuditLogRepository;
import com.flamingo.ndthub.domain.repository.DocumentRepository;
import com.flamingo.ndthub.domain.repository.FigureRepository;
import com.flamingo.ndthub.domain.repository.ManufacturerRepository;
import com.flamingo.ndthub.domain.repository.SectionRepository;
import com.flamingo.ndthub.domain.repository.UserRepository;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ManufacturerRepository manufacturerRepository;
  private final DocumentRepository documentRepository;
  private final SectionRepository sectionRepository;
  private final FigureRepository figureRepository;
  private final UserRepository userRepository;
  private final AuditLogRepository auditLogRepository;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "ok");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "ndt-document-hub");
    return ResponseEntity.ok(health);
  }

  /** Returns record counts. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("manufacturers", manufacturerRepository.count());
    stats.put("documents", documentRepository.count());
    stats.put("sections", sectionRepository.count());
    stats.put("figures", figureRepository.count());
    stats.put("users", userRepository.count());
    stats.put("audit_logs", auditLogRepository.count());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
