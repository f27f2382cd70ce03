package com.flamingo.ndthub.service.auth;

import com.flamingo.ndthub.config.HubConfig;
import com.flamingo.ndthub.domain.entity.SessionToken;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.domain.repository.SessionTokenRepository;
import com.flamingo.ndthub.domain.repository.UserRepository;
import com.flamingo.ndthub.exception.ForbiddenException;
import com.flamingo.ndthub.exception.UnauthorizedException;
import com.flamingo.ndthub.service.audit.AuditService;
import com.flamingo.ndthub.service.audit.AuditTarget;
import io.micrometer.core.instrument.MeterRegistry;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the AuthService backed by opaque tokens stored in the database. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthServiceImpl implements AuthService {

  private static final SecureRandom RANDOM = new SecureRandom();

  private final UserRepository userRepository;
  private final SessionTokenRepository sessionTokenRepository;
  private final PasswordEncoder passwordEncoder;
  private final AuditService auditService;
  private final HubConfig hubConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public LoginResult login(String username, String password, String ip, String userAgent) {
    User user =
        userRepository.findByUsername(username == null ? "" : username.strip()).orElse(null);
    if (user == null
        || password == null
        || !passwordEncoder.matches(password, user.getPasswordHash())) {
      meterRegistry.counter("auth.login", "result", "invalid").increment();
      log.warn("Failed login for username {}", username);
      throw new UnauthorizedException("Invalid credentials");
    }
    if (!user.isActive()) {
      meterRegistry.counter("auth.login", "result", "inactive").increment();
      log.warn("Login refused for inactive user {}", user.getUsername());
      throw new ForbiddenException("User inactive");
    }

    SessionToken session =
        SessionToken.builder()
            .user(user)
            .token(generateToken())
            .ip(ip)
            .userAgent(truncate(userAgent, 512))
            .build();
    sessionTokenRepository.save(session);

    auditService.record(user, AuditAction.LOGIN, AuditTarget.none(), Map.of());
    meterRegistry.counter("auth.login", "result", "success").increment();
    log.info("User {} logged in", user.getUsername());
    return new LoginResult(session.getToken(), user);
  }

  @Override
  @Transactional
  public User authenticate(String token, String path) {
    SessionToken session =
        sessionTokenRepository
            .findByToken(token)
            .orElseThrow(() -> new UnauthorizedException("Invalid token"));
    User user = session.getUser();
    if (!user.isActive()) {
      throw new UnauthorizedException("Inactive user");
    }
    session.touch(path);
    return user;
  }

  @Override
  @Transactional
  public void logout(User user) {
    int revoked = sessionTokenRepository.deleteByUserId(user.getId());
    auditService.record(user, AuditAction.LOGOUT, AuditTarget.none(), Map.of());
    log.info("User {} logged out, {} token(s) revoked", user.getUsername(), revoked);
  }

  String generateToken() {
    byte[] bytes = new byte[hubConfig.getAuth().getTokenBytes()];
    RANDOM.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
