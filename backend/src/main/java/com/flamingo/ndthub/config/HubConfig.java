package com.flamingo.ndthub.config;

import com.flamingo.ndthub.domain.enums.UserRole;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document hub. */
@Configuration
@ConfigurationProperties(prefix = "hub")
@Getter
@Setter
public class HubConfig {

  private Storage storage = new Storage();
  private Auth auth = new Auth();
  private Audit audit = new Audit();
  private Search search = new Search();
  private Seed seed = new Seed();

  @Getter
  @Setter
  public static class Storage {
    /** Directory under which PDFs are stored; storage keys are relative to it. */
    private String root = "storage";
  }

  @Getter
  @Setter
  public static class Auth {
    /** Random bytes per session token before base64 encoding. */
    private int tokenBytes = 32;
  }

  @Getter
  @Setter
  public static class Audit {
    private int defaultLimit = 200;
    private int maxLimit = 1000;
  }

  @Getter
  @Setter
  public static class Search {
    private int timeoutMs = 10_000;
    private String userAgent = "Mozilla/5.0 (NDT-Document-Hub)";
    private List<Source> sources = new ArrayList<>();
  }

  /** One external site queried by the search tool. */
  @Getter
  @Setter
  public static class Source {
    private String name;

    /** URL with a {@code {query}} placeholder for the URL-encoded query. */
    private String urlTemplate;

    private String cardSelector = ".search-result";
    private String titleSelector = "h3";
    private String descriptionSelector = ".description";
    private String featureSelector = ".tag";
    private String linkSelector = "a";
  }

  @Getter
  @Setter
  public static class Seed {
    private boolean enabled = true;
    private List<SeedManufacturer> manufacturers = new ArrayList<>();
    private List<SeedUser> users = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class SeedManufacturer {
    private String name;
    private String themePrimary;
    private String themeSecondary;
  }

  @Getter
  @Setter
  public static class SeedUser {
    private String username;
    private String password;
    private UserRole role = UserRole.USER;
  }
}
