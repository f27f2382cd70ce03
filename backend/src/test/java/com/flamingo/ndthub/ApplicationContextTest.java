package com.flamingo.ndthub;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ndthub.domain.repository.ManufacturerRepository;
import com.flamingo.ndthub.domain.repository.UserRepository;
import com.flamingo.ndthub.service.auth.AuthService;
import com.flamingo.ndthub.service.document.DocumentService;
import com.flamingo.ndthub.service.search.ExternalSearchService;
import com.flamingo.ndthub.service.user.UserAdminService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the application context loads against the in-memory test database. */
@SpringBootTest
@AutoConfigureMockMvc
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private ManufacturerRepository manufacturerRepository;
  @Autowired private UserRepository userRepository;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(AuthService.class)).isNotNull();
    assertThat(applicationContext.getBean(UserAdminService.class)).isNotNull();
    assertThat(applicationContext.getBean(ExternalSearchService.class)).isNotNull();
  }

  @Test
  @DisplayName("Seed data should be present")
  void seedDataShouldBePresent() {
    assertThat(manufacturerRepository.findByName("Boeing")).isPresent();
    assertThat(userRepository.findByUsername("admin")).isPresent();
    assertThat(userRepository.findByUsername("user")).isPresent();
  }
}
