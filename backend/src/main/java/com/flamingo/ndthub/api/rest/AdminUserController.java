package com.flamingo.ndthub.api.rest;

import com.flamingo.ndthub.api.auth.AdminOnly;
import com.flamingo.ndthub.api.auth.AuthInterceptor;
import com.flamingo.ndthub.api.dto.request.CreateUserRequest;
import com.flamingo.ndthub.api.dto.request.UpdateUserRequest;
import com.flamingo.ndthub.api.dto.response.SessionReportResponse;
import com.flamingo.ndthub.api.dto.response.UserResponse;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.service.user.UserAdminService;
import com.flamingo.ndthub.service.user.UserChanges;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for user administration and the session report. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@AdminOnly
public class AdminUserController {

  private final UserAdminService userAdminService;

  @GetMapping("/users")
  public ResponseEntity<List<UserResponse>> getUsers() {
    return ResponseEntity.ok(
        userAdminService.getAllUsers().stream().map(UserResponse::fromEntity).toList());
  }

  /** Creates a user; a taken username yields 409. */
  @PostMapping("/users")
  public ResponseEntity<UserResponse> createUser(
      @Valid @RequestBody CreateUserRequest request,
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User admin) {
    User created =
        userAdminService.createUser(
            request.getUsername(),
            request.getPassword(),
            request.getRole(),
            request.getIsActive() == null || request.getIsActive(),
            admin);
    return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.fromEntity(created));
  }

  @PatchMapping("/users/{userId}")
  public ResponseEntity<UserResponse> updateUser(
      @PathVariable Long userId,
      @RequestBody UpdateUserRequest request,
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User admin) {
    User updated =
        userAdminService.updateUser(
            userId,
            new UserChanges(request.getRole(), request.getPassword(), request.getIsActive()),
            admin);
    return ResponseEntity.ok(UserResponse.fromEntity(updated));
  }

  /** Sessions with the most recent activity first. */
  @GetMapping("/reports/sessions")
  public ResponseEntity<List<SessionReportResponse>> getSessionReport(
      @RequestParam(value = "limit", required = false) Integer limit) {
    return ResponseEntity.ok(
        userAdminService.getRecentSessions(limit).stream()
            .map(SessionReportResponse::fromEntity)
            .toList());
  }
}
