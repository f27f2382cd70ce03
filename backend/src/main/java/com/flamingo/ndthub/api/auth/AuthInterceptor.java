package com.flamingo.ndthub.api.auth;

import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.exception.ForbiddenException;
import com.flamingo.ndthub.exception.UnauthorizedException;
import com.flamingo.ndthub.service.auth.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the bearer token of an API request to its user.
 *
 * <p>The user is exposed to controllers as the request attribute {@link #CURRENT_USER}. Handlers
 * annotated with {@link AdminOnly} are refused to non-admins. Failures are thrown as exceptions
 * so the global handler renders them like any other API error.
 */
@Component
@RequiredArgsConstructor
public class AuthInterceptor implements HandlerInterceptor {

  public static final String CURRENT_USER = "ndthub.currentUser";

  private static final String BEARER_PREFIX = "Bearer ";

  private final AuthService authService;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
      return true;
    }

    String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (token == null) {
      throw new UnauthorizedException("Missing token");
    }
    User user = authService.authenticate(token, request.getRequestURI());

    if (requiresAdmin(handler) && !user.isAdmin()) {
      throw new ForbiddenException("Admin only");
    }
    request.setAttribute(CURRENT_USER, user);
    return true;
  }

  static String extractToken(String header) {
    if (header == null
        || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    String token = header.substring(BEARER_PREFIX.length()).strip();
    return token.isEmpty() ? null : token;
  }

  private static boolean requiresAdmin(Object handler) {
    if (!(handler instanceof HandlerMethod method)) {
      return false;
    }
    return method.hasMethodAnnotation(AdminOnly.class)
        || method.getBeanType().isAnnotationPresent(AdminOnly.class);
  }
}
