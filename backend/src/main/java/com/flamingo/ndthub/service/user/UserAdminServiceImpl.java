package com.flamingo.ndthub.service.user;

import com.flamingo.ndthub.config.HubConfig;
import com.flamingo.ndthub.domain.entity.SessionToken;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.domain.enums.UserRole;
import com.flamingo.ndthub.domain.repository.SessionTokenRepository;
import com.flamingo.ndthub.domain.repository.UserRepository;
import com.flamingo.ndthub.exception.DuplicateUsernameException;
import com.flamingo.ndthub.exception.UserNotFoundException;
import com.flamingo.ndthub.service.audit.AuditService;
import com.flamingo.ndthub.service.audit.AuditTarget;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the UserAdminService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserAdminServiceImpl implements UserAdminService {

  private final UserRepository userRepository;
  private final SessionTokenRepository sessionTokenRepository;
  private final PasswordEncoder passwordEncoder;
  private final AuditService auditService;
  private final HubConfig hubConfig;

  @Override
  @Transactional(readOnly = true)
  public List<User> getAllUsers() {
    return userRepository.findAllByOrderByUsernameAsc();
  }

  @Override
  @Transactional
  public User createUser(
      String username, String password, UserRole role, boolean active, User actor) {
    String normalized = username.strip();
    if (userRepository.existsByUsername(normalized)) {
      throw new DuplicateUsernameException(normalized);
    }

    User user =
        User.builder()
            .username(normalized)
            .passwordHash(passwordEncoder.encode(password))
            .role(role == null ? UserRole.USER : role)
            .active(active)
            .build();
    User saved = userRepository.save(user);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("username", saved.getUsername());
    metadata.put("role", saved.getRole().name());
    metadata.put("is_active", saved.isActive());
    auditService.record(actor, AuditAction.CREATE_USER, AuditTarget.none(), metadata);

    log.info(
        "User {} created with role {} by {}",
        saved.getUsername(),
        saved.getRole(),
        actor.getUsername());
    return saved;
  }

  @Override
  @Transactional
  public User updateUser(Long userId, UserChanges changes, User actor) {
    User user =
        userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("user_id", userId);
    if (changes.role() != null) {
      user.setRole(changes.role());
      metadata.put("role", changes.role().name());
    }
    if (changes.active() != null) {
      user.setActive(changes.active());
      metadata.put("is_active", changes.active());
    }
    if (changes.password() != null && !changes.password().isBlank()) {
      user.setPasswordHash(passwordEncoder.encode(changes.password()));
      metadata.put("password_changed", true);
    }
    User saved = userRepository.save(user);
    auditService.record(actor, AuditAction.UPDATE_USER, AuditTarget.none(), metadata);

    log.info("User {} updated by {}", saved.getUsername(), actor.getUsername());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<SessionToken> getRecentSessions(Integer limit) {
    HubConfig.Audit audit = hubConfig.getAudit();
    int effective = limit == null || limit < 1 ? audit.getDefaultLimit() : limit;
    effective = Math.min(effective, audit.getMaxLimit());
    return sessionTokenRepository.findAllByOrderByLastSeenAtDesc(PageRequest.of(0, effective));
  }
}
