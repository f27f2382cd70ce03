package com.flamingo.ndthub.api.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ndthub.api.rest.AuditLogController;
import com.flamingo.ndthub.api.rest.DocumentController;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.UserRole;
import com.flamingo.ndthub.domain.repository.UserRepository;
import com.flamingo.ndthub.exception.ForbiddenException;
import com.flamingo.ndthub.exception.UnauthorizedException;
import com.flamingo.ndthub.service.audit.AuditService;
import com.flamingo.ndthub.service.auth.AuthService;
import com.flamingo.ndthub.service.document.DocumentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

@ExtendWith(MockitoExtension.class)
class AuthInterceptorTest {

  @Mock private AuthService authService;

  private AuthInterceptor interceptor;
  private MockHttpServletRequest request;
  private final MockHttpServletResponse response = new MockHttpServletResponse();

  private final User viewer = User.builder().id(2L).username("user").role(UserRole.USER).build();
  private final User admin = User.builder().id(1L).username("admin").role(UserRole.ADMIN).build();

  @BeforeEach
  void setUp() {
    interceptor = new AuthInterceptor(authService);
    request = new MockHttpServletRequest("GET", "/api/documents/1/sections");
  }

  private static HandlerMethod sectionsHandler() throws NoSuchMethodException {
    return new HandlerMethod(
        new DocumentController(mock(DocumentService.class)),
        DocumentController.class.getMethod("getSections", Long.class, User.class));
  }

  private static HandlerMethod deleteHandler() throws NoSuchMethodException {
    return new HandlerMethod(
        new DocumentController(mock(DocumentService.class)),
        DocumentController.class.getMethod("deleteDocument", Long.class, User.class));
  }

  private static HandlerMethod auditLogHandler() throws NoSuchMethodException {
    return new HandlerMethod(
        new AuditLogController(mock(AuditService.class), mock(UserRepository.class)),
        AuditLogController.class.getMethod("getAuditLogs", Integer.class));
  }

  @Test
  void shouldExposeAuthenticatedUser() throws Exception {
    request.addHeader("Authorization", "Bearer abc123");
    when(authService.authenticate("abc123", "/api/documents/1/sections")).thenReturn(viewer);

    boolean proceed = interceptor.preHandle(request, response, sectionsHandler());

    assertThat(proceed).isTrue();
    assertThat(request.getAttribute(AuthInterceptor.CURRENT_USER)).isSameAs(viewer);
  }

  @Test
  void shouldRejectMissingToken() {
    assertThatThrownBy(() -> interceptor.preHandle(request, response, sectionsHandler()))
        .isInstanceOf(UnauthorizedException.class)
        .hasMessage("Missing token");
    verify(authService, never()).authenticate(anyString(), anyString());
  }

  @Test
  void shouldRejectNonBearerScheme() {
    request.addHeader("Authorization", "Basic dXNlcjpwdw==");

    assertThatThrownBy(() -> interceptor.preHandle(request, response, sectionsHandler()))
        .isInstanceOf(UnauthorizedException.class)
        .hasMessage("Missing token");
  }

  @Test
  void shouldPropagateInvalidToken() {
    request.addHeader("Authorization", "Bearer stale");
    when(authService.authenticate("stale", "/api/documents/1/sections"))
        .thenThrow(new UnauthorizedException("Invalid token"));

    assertThatThrownBy(() -> interceptor.preHandle(request, response, sectionsHandler()))
        .isInstanceOf(UnauthorizedException.class)
        .hasMessage("Invalid token");
  }

  @Test
  void shouldRefuseAdminMethodToRegularUser() {
    request.addHeader("Authorization", "Bearer abc123");
    when(authService.authenticate(anyString(), anyString())).thenReturn(viewer);

    assertThatThrownBy(() -> interceptor.preHandle(request, response, deleteHandler()))
        .isInstanceOf(ForbiddenException.class)
        .hasMessage("Admin only");
  }

  @Test
  void shouldRefuseAdminControllerToRegularUser() {
    request.addHeader("Authorization", "Bearer abc123");
    when(authService.authenticate(anyString(), anyString())).thenReturn(viewer);

    assertThatThrownBy(() -> interceptor.preHandle(request, response, auditLogHandler()))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void shouldAllowAdminMethodToAdmin() throws Exception {
    request.addHeader("Authorization", "Bearer root");
    when(authService.authenticate(anyString(), anyString())).thenReturn(admin);

    assertThat(interceptor.preHandle(request, response, deleteHandler())).isTrue();
  }

  @Test
  void shouldParseBearerHeaderCaseInsensitively() {
    assertThat(AuthInterceptor.extractToken("bearer   tok ")).isEqualTo("tok");
    assertThat(AuthInterceptor.extractToken("Bearer ")).isNull();
    assertThat(AuthInterceptor.extractToken(null)).isNull();
  }
}
