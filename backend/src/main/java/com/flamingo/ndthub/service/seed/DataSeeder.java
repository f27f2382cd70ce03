package com.flamingo.ndthub.service.seed;

import com.flamingo.ndthub.config.HubConfig;
import com.flamingo.ndthub.domain.entity.Manufacturer;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.repository.ManufacturerRepository;
import com.flamingo.ndthub.domain.repository.UserRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Startup bean that fills an empty database with the configured manufacturers and users.
 *
 * <p>Each table is seeded only while it is empty, so restarts never duplicate rows or reset
 * passwords that have since been changed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

  private final HubConfig hubConfig;
  private final ManufacturerRepository manufacturerRepository;
  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;

  @Override
  @Transactional
  public void run(String... args) {
    HubConfig.Seed seed = hubConfig.getSeed();
    if (!seed.isEnabled()) {
      log.info("Seeding disabled, skipping");
      return;
    }
    seedManufacturers(seed.getManufacturers());
    seedUsers(seed.getUsers());
  }

  void seedManufacturers(List<HubConfig.SeedManufacturer> manufacturers) {
    if (manufacturerRepository.count() > 0) {
      log.debug("Manufacturers present, skipping seed");
      return;
    }
    List<Manufacturer> entities =
        manufacturers.stream()
            .map(
                m ->
                    Manufacturer.builder()
                        .name(m.getName())
                        .themePrimary(m.getThemePrimary())
                        .themeSecondary(m.getThemeSecondary())
                        .build())
            .toList();
    manufacturerRepository.saveAll(entities);
    log.info("Seeded {} manufacturers", entities.size());
  }

  void seedUsers(List<HubConfig.SeedUser> users) {
    if (userRepository.count() > 0) {
      log.debug("Users present, skipping seed");
      return;
    }
    List<User> entities =
        users.stream()
            .map(
                u ->
                    User.builder()
                        .username(u.getUsername())
                        .passwordHash(passwordEncoder.encode(u.getPassword()))
                        .role(u.getRole())
                        .active(true)
                        .build())
            .toList();
    userRepository.saveAll(entities);
    log.info("Seeded {} users", entities.size());
  }
}
