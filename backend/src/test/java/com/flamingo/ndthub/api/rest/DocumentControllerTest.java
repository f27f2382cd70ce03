package com.flamingo.ndthub.api.rest;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.flamingo.ndthub.api.auth.AuthInterceptor;
import com.flamingo.ndthub.domain.entity.Document;
import com.flamingo.ndthub.domain.entity.Figure;
import com.flamingo.ndthub.domain.entity.Manufacturer;
import com.flamingo.ndthub.domain.entity.Section;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.UserRole;
import com.flamingo.ndthub.exception.DocumentNotFoundException;
import com.flamingo.ndthub.exception.DocumentProcessingException;
import com.flamingo.ndthub.exception.GlobalExceptionHandler;
import com.flamingo.ndthub.exception.StoredFileMissingException;
import com.flamingo.ndthub.service.document.DocumentDetail;
import com.flamingo.ndthub.service.document.DocumentMetadata;
import com.flamingo.ndthub.service.document.DocumentService;
import com.flamingo.ndthub.service.document.StoredPdf;
import com.flamingo.ndthub.service.document.UploadResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.ResourceHttpMessageConverter;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentController Tests")
class DocumentControllerTest {

  @Mock private DocumentService documentService;

  @TempDir Path tempDir;

  private MockMvc mockMvc;
  private User admin;
  private Document document;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper =
        Jackson2ObjectMapperBuilder.json()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .build();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DocumentController(documentService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .setMessageConverters(
                new MappingJackson2HttpMessageConverter(objectMapper),
                new ResourceHttpMessageConverter())
            .build();

    admin = User.builder().id(1L).username("admin").role(UserRole.ADMIN).build();
    document =
        Document.builder()
            .id(10L)
            .manufacturer(Manufacturer.builder().id(3L).name("Boeing").build())
            .uploadedBy(admin)
            .title("UT Manual")
            .originalFilename("ut manual.pdf")
            .storageKey("pdfs/0a1b2c3d_ut_manual.pdf")
            .revisionDate("2024-05")
            .build();
  }

  private Section section(Long id, String heading, int order) {
    return Section.builder()
        .id(id)
        .document(document)
        .headingText(heading)
        .orderIndex(order)
        .pageStart(order)
        .pageEnd(order)
        .build();
  }

  @Test
  @DisplayName("Should return 201 with outline counts on upload")
  void shouldUploadDocument() throws Exception {
    when(documentService.uploadDocument(eq(3L), any(DocumentMetadata.class), any(), eq(admin)))
        .thenReturn(new UploadResult(document, 4, 2));

    mockMvc
        .perform(
            multipart("/api/manufacturers/{id}/documents", 3L)
                .file(
                    new MockMultipartFile(
                        "file", "ut manual.pdf", "application/pdf", new byte[] {1}))
                .param("title", "UT Manual")
                .param("revision_date", "2024-05")
                .requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.sections_created").value(4))
        .andExpect(jsonPath("$.figures_created").value(2))
        .andExpect(jsonPath("$.document.id").value(10))
        .andExpect(jsonPath("$.document.manufacturer_id").value(3))
        .andExpect(jsonPath("$.document.revision_date").value("2024-05"));

    verify(documentService)
        .uploadDocument(
            eq(3L), eq(new DocumentMetadata("UT Manual", "2024-05", null)), any(), eq(admin));
  }

  @Test
  @DisplayName("Should return 422 when the PDF cannot be read")
  void shouldReturnUnprocessableForMalformedPdf() throws Exception {
    when(documentService.uploadDocument(any(), any(), any(), any()))
        .thenThrow(new DocumentProcessingException("x.pdf", "bad", new IOException()));

    mockMvc
        .perform(
            multipart("/api/manufacturers/{id}/documents", 3L)
                .file(new MockMultipartFile("file", "x.pdf", "application/pdf", new byte[] {1}))
                .param("title", "X")
                .requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_003"))
        .andExpect(jsonPath("$.error_id").exists());
  }

  @Test
  @DisplayName("Should return 400 when the title is missing")
  void shouldRejectUploadWithoutTitle() throws Exception {
    mockMvc
        .perform(
            multipart("/api/manufacturers/{id}/documents", 3L)
                .file(new MockMultipartFile("file", "x.pdf", "application/pdf", new byte[] {1}))
                .requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should return document with ordered sections")
  void shouldGetDocumentDetail() throws Exception {
    Section first = section(1L, "1 Scope", 1);
    Section second = section(2L, "2 Method", 2);
    when(documentService.viewDocument(10L, admin))
        .thenReturn(new DocumentDetail(document, List.of(first, second)));

    mockMvc
        .perform(get("/api/documents/{id}", 10L).requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.document.title").value("UT Manual"))
        .andExpect(jsonPath("$.sections[0].heading_text").value("1 Scope"))
        .andExpect(jsonPath("$.sections[0].heading_level").value("H1"))
        .andExpect(jsonPath("$.sections[1].order_index").value(2));
  }

  @Test
  @DisplayName("Should return 404 for a missing document")
  void shouldReturnNotFound() throws Exception {
    when(documentService.viewDocument(99L, admin)).thenThrow(new DocumentNotFoundException(99L));

    mockMvc
        .perform(get("/api/documents/{id}", 99L).requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("DOCUMENT_001"))
        .andExpect(jsonPath("$.path").value("/api/documents/99"));
  }

  @Test
  @DisplayName("Should list figures with nullable section reference")
  void shouldListDocumentFigures() throws Exception {
    Section section = section(5L, "1 Scope", 1);
    Figure loose =
        Figure.builder()
            .id(1L)
            .document(document)
            .pageNumber(1)
            .captionText("Figure 1")
            .orderIndex(1)
            .build();
    Figure attached =
        Figure.builder()
            .id(2L)
            .document(document)
            .section(section)
            .pageNumber(2)
            .captionText("Fig. 2")
            .orderIndex(2)
            .build();
    when(documentService.getDocumentFigures(10L, admin)).thenReturn(List.of(loose, attached));

    mockMvc
        .perform(
            get("/api/documents/{id}/figures", 10L)
                .requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].section_id").doesNotExist())
        .andExpect(jsonPath("$[1].section_id").value(5))
        .andExpect(jsonPath("$[1].caption_text").value("Fig. 2"));
  }

  @Test
  @DisplayName("Should update only metadata given as form fields")
  void shouldPatchDocument() throws Exception {
    when(documentService.updateDocument(eq(10L), any(DocumentMetadata.class), eq(admin)))
        .thenReturn(document);

    mockMvc
        .perform(
            patch("/api/documents/{id}", 10L)
                .param("title", "UT Manual")
                .requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isOk());

    verify(documentService)
        .updateDocument(10L, new DocumentMetadata("UT Manual", null, null), admin);
  }

  @Test
  @DisplayName("Should return 204 on delete")
  void shouldDeleteDocument() throws Exception {
    mockMvc
        .perform(
            delete("/api/documents/{id}", 10L).requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isNoContent());

    verify(documentService).deleteDocument(10L, admin);
  }

  @Test
  @DisplayName("Should stream the stored PDF with its original name")
  void shouldStreamPdf() throws Exception {
    Path file = Files.write(tempDir.resolve("stored.pdf"), new byte[] {'%', 'P', 'D', 'F'});
    when(documentService.getPdf(10L)).thenReturn(new StoredPdf(file, "ut manual.pdf"));

    mockMvc
        .perform(get("/api/documents/{id}/pdf", 10L))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", "application/pdf"))
        .andExpect(
            header()
                .string(
                    "Content-Disposition",
                    containsString("ut manual.pdf")));
  }

  @Test
  @DisplayName("Should return 404 when the stored PDF is gone")
  void shouldReturnNotFoundForMissingBlob() throws Exception {
    when(documentService.getPdf(10L)).thenThrow(new StoredFileMissingException("pdfs/x.pdf"));

    mockMvc
        .perform(get("/api/documents/{id}/pdf", 10L))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("DOCUMENT_004"));
  }

  @Test
  @DisplayName("Should pass the title filter through")
  void shouldListDocumentsWithFilter() throws Exception {
    when(documentService.getDocumentsByManufacturer(3L, "ut", admin))
        .thenReturn(List.of(document));

    mockMvc
        .perform(
            get("/api/manufacturers/{id}/documents", 3L)
                .param("q", "ut")
                .requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].original_filename").value("ut manual.pdf"));
  }

  @Test
  @DisplayName("Should list documents without a filter")
  void shouldListDocumentsWithoutFilter() throws Exception {
    when(documentService.getDocumentsByManufacturer(eq(3L), isNull(), eq(admin)))
        .thenReturn(List.of());

    mockMvc
        .perform(
            get("/api/manufacturers/{id}/documents", 3L)
                .requestAttr(AuthInterceptor.CURRENT_USER, admin))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isEmpty());
  }
}
