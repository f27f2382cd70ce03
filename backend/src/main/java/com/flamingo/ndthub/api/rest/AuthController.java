package com.flamingo.ndthub.api.rest;

import com.flamingo.ndthub.api.auth.AuthInterceptor;
import com.flamingo.ndthub.api.dto.request.LoginRequest;
import com.flamingo.ndthub.api.dto.response.LoginResponse;
import com.flamingo.ndthub.api.dto.response.UserResponse;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.service.auth.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for login, logout and session activity. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AuthController {

  private final AuthService authService;

  /** Exchanges credentials for a bearer token. */
  @PostMapping("/auth/login")
  public ResponseEntity<LoginResponse> login(
      @Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
    return ResponseEntity.ok(
        LoginResponse.from(
            authService.login(
                request.getUsername(),
                request.getPassword(),
                httpRequest.getRemoteAddr(),
                httpRequest.getHeader(HttpHeaders.USER_AGENT))));
  }

  /** Revokes every token of the caller. */
  @PostMapping("/auth/logout")
  public ResponseEntity<Map<String, Object>> logout(
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    authService.logout(user);
    return ResponseEntity.ok(Map.of("ok", true));
  }

  /** Returns the caller. */
  @GetMapping("/auth/me")
  public ResponseEntity<UserResponse> me(
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    return ResponseEntity.ok(UserResponse.fromEntity(user));
  }

  /** Keeps the caller's session activity current; authentication itself records the hit. */
  @PostMapping("/activity/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("ok", true));
  }
}
