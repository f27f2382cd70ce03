package com.flamingo.ndthub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.domain.repository.AuditLogRepository;
import com.flamingo.ndthub.domain.repository.DocumentRepository;
import com.flamingo.ndthub.domain.repository.FigureRepository;
import com.flamingo.ndthub.domain.repository.ManufacturerRepository;
import com.flamingo.ndthub.domain.repository.SectionRepository;
import com.jayway.jsonpath.JsonPath;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

/** End-to-end flows through the HTTP layer, the upload pipeline and the database. */
@SpringBootTest
@AutoConfigureMockMvc
class DocumentHubIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ManufacturerRepository manufacturerRepository;
  @Autowired private DocumentRepository documentRepository;
  @Autowired private SectionRepository sectionRepository;
  @Autowired private FigureRepository figureRepository;
  @Autowired private AuditLogRepository auditLogRepository;

  private Long boeingId;

  @BeforeEach
  void setUp() {
    boeingId = manufacturerRepository.findByName("Boeing").orElseThrow().getId();
  }

  private String login(String username, String password) throws Exception {
    String body =
        mockMvc
            .perform(
                post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        "{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}"))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    return JsonPath.read(body, "$.token");
  }

  private static String bearer(String token) {
    return "Bearer " + token;
  }

  private static MockMultipartFile pdf(String name, byte[] content) {
    return new MockMultipartFile("file", name, "application/pdf", content);
  }

  @Test
  @DisplayName("Should upload, browse and delete a document with its outline")
  void shouldUploadBrowseAndDelete() throws Exception {
    String token = login("admin", "admin123");
    byte[] manual =
        TestPdfs.create(
            List.of(
                List.of("Figure 1 Aircraft overview"),
                List.of("1 Scope", "This procedure covers bonded skins.", "See Figure 2 below"),
                List.of("2 Equipment", "Fig. 3 Probe holder")));

    String uploadBody =
        mockMvc
            .perform(
                multipart("/api/manufacturers/{id}/documents", boeingId)
                    .file(pdf("UT Manual.pdf", manual))
                    .param("title", "UT Manual")
                    .param("revision_date", "Rev B")
                    .header(HttpHeaders.AUTHORIZATION, bearer(token)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.sections_created").value(2))
            .andExpect(jsonPath("$.figures_created").value(3))
            .andExpect(jsonPath("$.document.title").value("UT Manual"))
            .andReturn()
            .getResponse()
            .getContentAsString();
    Long documentId = ((Number) JsonPath.read(uploadBody, "$.document.id")).longValue();

    String sectionsBody =
        mockMvc
            .perform(
                get("/api/documents/{id}/sections", documentId)
                    .header(HttpHeaders.AUTHORIZATION, bearer(token)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].heading_text").value("1 Scope"))
            .andExpect(jsonPath("$[0].page_start").value(2))
            .andExpect(jsonPath("$[1].heading_text").value("2 Equipment"))
            .andExpect(jsonPath("$[1].order_index").value(2))
            .andReturn()
            .getResponse()
            .getContentAsString();
    Integer scopeId = JsonPath.read(sectionsBody, "$[0].id");

    mockMvc
        .perform(
            get("/api/documents/{id}/figures", documentId)
                .header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].caption_text").value("Figure 1 Aircraft overview"))
        .andExpect(jsonPath("$[0].section_id").doesNotExist())
        .andExpect(jsonPath("$[1].section_id").value(scopeId))
        .andExpect(jsonPath("$[2].order_index").value(3));

    mockMvc
        .perform(
            get("/api/sections/{id}/figures", scopeId)
                .header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].caption_text").value("See Figure 2 below"));

    mockMvc
        .perform(
            get("/api/documents/{id}/pdf", documentId)
                .header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.APPLICATION_PDF))
        .andExpect(content().bytes(manual));

    assertThat(auditLogRepository.findByDocumentIdAndActionType(documentId, AuditAction.UPLOAD_DOC))
        .singleElement()
        .satisfies(
            entry ->
                assertThat(entry.getMetadataJson())
                    .contains("\"sections_created\":2")
                    .contains("\"figures_created\":3"));

    mockMvc
        .perform(
            delete("/api/documents/{id}", documentId)
                .header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isNoContent());

    assertThat(documentRepository.findById(documentId)).isEmpty();
    assertThat(sectionRepository.countByDocumentId(documentId)).isZero();
    assertThat(figureRepository.countByDocumentId(documentId)).isZero();
    mockMvc
        .perform(
            get("/api/documents/{id}", documentId).header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("Should fall back to one overview section when no heading is found")
  void shouldCreateFallbackSection() throws Exception {
    String token = login("admin", "admin123");
    byte[] memo = TestPdfs.create(List.of(List.of("Service memo"), List.of(), List.of("End")));

    mockMvc
        .perform(
            multipart("/api/manufacturers/{id}/documents", boeingId)
                .file(pdf("memo.pdf", memo))
                .param("title", "Memo")
                .header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.sections_created").value(1))
        .andExpect(jsonPath("$.figures_created").value(0));
  }

  @Test
  @DisplayName("Should persist nothing when the PDF is malformed")
  void shouldRejectMalformedPdf() throws Exception {
    String token = login("admin", "admin123");
    long documentsBefore = documentRepository.count();
    long sectionsBefore = sectionRepository.count();

    mockMvc
        .perform(
            multipart("/api/manufacturers/{id}/documents", boeingId)
                .file(pdf("broken.pdf", "not a pdf at all".getBytes()))
                .param("title", "Broken")
                .header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_003"));

    assertThat(documentRepository.count()).isEqualTo(documentsBefore);
    assertThat(sectionRepository.count()).isEqualTo(sectionsBefore);
  }

  @Test
  @DisplayName("Should require a token and admin rights")
  void shouldEnforceAuthentication() throws Exception {
    mockMvc
        .perform(get("/api/manufacturers/{id}/documents", boeingId))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Missing token"));

    mockMvc
        .perform(
            get("/api/manufacturers/{id}/documents", boeingId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Invalid token"));

    String userToken = login("user", "user123");
    mockMvc
        .perform(
            multipart("/api/manufacturers/{id}/documents", boeingId)
                .file(pdf("x.pdf", TestPdfs.create(List.of(List.of("1 Scope")))))
                .param("title", "X")
                .header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.message").value("Admin only"));

    mockMvc
        .perform(get("/api/audit-logs").header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
        .andExpect(status().isForbidden());
  }

  @Test
  @DisplayName("Should reject wrong credentials and revoke tokens on logout")
  void shouldLoginAndLogout() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"admin\",\"password\":\"wrong\"}"))
        .andExpect(status().isUnauthorized());

    String token = login("user", "user123");
    mockMvc
        .perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.username").value("user"))
        .andExpect(jsonPath("$.role").value("USER"))
        .andExpect(jsonPath("$.is_active").value(true));

    mockMvc
        .perform(post("/api/auth/logout").header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isUnauthorized());
  }

  @Test
  @DisplayName("Should let admins manage users and read reports")
  void shouldAdministerUsers() throws Exception {
    String token = login("admin", "admin123");

    mockMvc
        .perform(
            post("/api/admin/users")
                .header(HttpHeaders.AUTHORIZATION, bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"level2\",\"password\":\"pw\",\"role\":\"USER\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.username").value("level2"))
        .andExpect(jsonPath("$.is_active").value(true))
        .andExpect(jsonPath("$.password_hash").doesNotExist());

    mockMvc
        .perform(
            post("/api/admin/users")
                .header(HttpHeaders.AUTHORIZATION, bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"level2\",\"password\":\"pw\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("USER_002"));

    mockMvc
        .perform(
            get("/api/admin/reports/sessions").header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].username").exists())
        .andExpect(jsonPath("$[0].active_seconds").isNumber());

    mockMvc
        .perform(get("/api/audit-logs?limit=5").header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].action_type").value("CREATE_USER"))
        .andExpect(jsonPath("$[0].username").value("admin"));
  }

  @Test
  @DisplayName("Should answer with the placeholder when no search source is configured")
  void shouldReturnSearchPlaceholder() throws Exception {
    String token = login("user", "user123");

    mockMvc
        .perform(
            get("/api/tool/search")
                .param("q", "phased array")
                .header(HttpHeaders.AUTHORIZATION, bearer(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.query").value("phased array"))
        .andExpect(jsonPath("$.results[0].title").value("No results"))
        .andExpect(jsonPath("$.results[0].source").value("system"));
  }

  @Test
  @DisplayName("Should expose public endpoints without a token")
  void shouldServePublicEndpoints() throws Exception {
    mockMvc
        .perform(get("/api/manufacturers"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Airbus"))
        .andExpect(jsonPath("$[0].theme_primary").exists());

    mockMvc.perform(get("/health")).andExpect(status().isOk());
    mockMvc.perform(get("/health/stats")).andExpect(jsonPath("$.manufacturers").isNumber());
  }
}
