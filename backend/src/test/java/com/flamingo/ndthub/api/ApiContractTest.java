package com.flamingo.ndthub.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ndthub.api.auth.AdminOnly;
import com.flamingo.ndthub.api.rest.AdminUserController;
import com.flamingo.ndthub.api.rest.AuditLogController;
import com.flamingo.ndthub.api.rest.AuthController;
import com.flamingo.ndthub.api.rest.DocumentController;
import com.flamingo.ndthub.api.rest.HealthController;
import com.flamingo.ndthub.api.rest.ManufacturerController;
import com.flamingo.ndthub.api.rest.SearchToolController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify controllers stay on their published paths:
 *
 * <ul>
 *   <li>GET /api/manufacturers - public manufacturer list
 *   <li>GET|POST /api/manufacturers/{id}/documents - list and upload
 *   <li>GET|PATCH|DELETE /api/documents/{id} - document detail and maintenance
 *   <li>GET /api/audit-logs - audit trail
 *   <li>/api/admin/** - user administration and reports
 *   <li>/api/tool/search - external search
 *   <li>/health - liveness outside the authenticated API
 * </ul>
 */
class ApiContractTest {

  private static String[] mapping(Class<?> controller) {
    RequestMapping mapping = controller.getAnnotation(RequestMapping.class);
    assertThat(mapping).isNotNull();
    return mapping.value();
  }

  private static boolean isAdminOnly(Class<?> controller, String methodName) {
    Method method =
        Arrays.stream(controller.getMethods())
            .filter(m -> m.getName().equals(methodName))
            .findFirst()
            .orElseThrow();
    return method.isAnnotationPresent(AdminOnly.class);
  }

  @Nested
  @DisplayName("Controller mappings")
  class Mappings {

    @Test
    @DisplayName("should map controllers to their base paths")
    void shouldMapControllersToBasePaths() {
      assertThat(mapping(ManufacturerController.class)).containsExactly("/api/manufacturers");
      assertThat(mapping(DocumentController.class)).containsExactly("/api");
      assertThat(mapping(AuthController.class)).containsExactly("/api");
      assertThat(mapping(AuditLogController.class)).containsExactly("/api/audit-logs");
      assertThat(mapping(AdminUserController.class)).containsExactly("/api/admin");
      assertThat(mapping(SearchToolController.class)).containsExactly("/api/tool/search");
      assertThat(mapping(HealthController.class)).containsExactly("/health");
    }
  }

  @Nested
  @DisplayName("Admin restrictions")
  class AdminRestrictions {

    @Test
    @DisplayName("should restrict document mutations to admins")
    void shouldRestrictDocumentMutations() {
      assertThat(isAdminOnly(DocumentController.class, "uploadDocument")).isTrue();
      assertThat(isAdminOnly(DocumentController.class, "updateDocument")).isTrue();
      assertThat(isAdminOnly(DocumentController.class, "deleteDocument")).isTrue();
      assertThat(isAdminOnly(DocumentController.class, "getDocument")).isFalse();
      assertThat(isAdminOnly(DocumentController.class, "getSections")).isFalse();
    }

    @Test
    @DisplayName("should restrict audit and user administration controllers to admins")
    void shouldRestrictAdminControllers() {
      assertThat(AuditLogController.class.isAnnotationPresent(AdminOnly.class)).isTrue();
      assertThat(AdminUserController.class.isAnnotationPresent(AdminOnly.class)).isTrue();
      assertThat(SearchToolController.class.isAnnotationPresent(AdminOnly.class)).isFalse();
    }
  }
}
