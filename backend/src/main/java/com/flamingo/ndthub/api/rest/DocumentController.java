package com.flamingo.ndthub.api.rest;

import com.flamingo.ndthub.api.auth.AdminOnly;
import com.flamingo.ndthub.api.auth.AuthInterceptor;
import com.flamingo.ndthub.api.dto.response.DocumentDetailResponse;
import com.flamingo.ndthub.api.dto.response.DocumentResponse;
import com.flamingo.ndthub.api.dto.response.FigureResponse;
import com.flamingo.ndthub.api.dto.response.SectionResponse;
import com.flamingo.ndthub.api.dto.response.UploadResponse;
import com.flamingo.ndthub.domain.entity.Document;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.service.document.DocumentMetadata;
import com.flamingo.ndthub.service.document.DocumentService;
import com.flamingo.ndthub.service.document.StoredPdf;
import com.flamingo.ndthub.service.document.UploadResult;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for documents and their outline. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Uploads a PDF to a manufacturer and extracts its outline. */
  @AdminOnly
  @PostMapping(
      value = "/manufacturers/{manufacturerId}/documents",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadDocument(
      @PathVariable Long manufacturerId,
      @RequestParam("title") String title,
      @RequestParam(value = "revision_date", required = false) String revisionDate,
      @RequestParam(value = "tags", required = false) String tags,
      @RequestParam("file") MultipartFile file,
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    UploadResult result =
        documentService.uploadDocument(
            manufacturerId, new DocumentMetadata(title, revisionDate, tags), file, user);
    return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.from(result));
  }

  /** Gets the documents of a manufacturer, newest first. */
  @GetMapping("/manufacturers/{manufacturerId}/documents")
  public ResponseEntity<List<DocumentResponse>> getDocumentsByManufacturer(
      @PathVariable Long manufacturerId,
      @RequestParam(value = "q", required = false) String query,
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    List<Document> documents =
        documentService.getDocumentsByManufacturer(manufacturerId, query, user);
    return ResponseEntity.ok(documents.stream().map(DocumentResponse::fromEntity).toList());
  }

  /** Gets a document with its sections. */
  @GetMapping("/documents/{documentId}")
  public ResponseEntity<DocumentDetailResponse> getDocument(
      @PathVariable Long documentId, @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    return ResponseEntity.ok(
        DocumentDetailResponse.from(documentService.viewDocument(documentId, user)));
  }

  /** Updates document metadata. */
  @AdminOnly
  @PatchMapping("/documents/{documentId}")
  public ResponseEntity<DocumentResponse> updateDocument(
      @PathVariable Long documentId,
      @RequestParam(value = "title", required = false) String title,
      @RequestParam(value = "revision_date", required = false) String revisionDate,
      @RequestParam(value = "tags", required = false) String tags,
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    Document document =
        documentService.updateDocument(
            documentId, new DocumentMetadata(title, revisionDate, tags), user);
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }

  /** Deletes a document with its sections and figures. */
  @AdminOnly
  @DeleteMapping("/documents/{documentId}")
  public ResponseEntity<Void> deleteDocument(
      @PathVariable Long documentId, @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    documentService.deleteDocument(documentId, user);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/documents/{documentId}/sections")
  public ResponseEntity<List<SectionResponse>> getSections(
      @PathVariable Long documentId, @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    return ResponseEntity.ok(
        documentService.getSections(documentId, user).stream()
            .map(SectionResponse::fromEntity)
            .toList());
  }

  @GetMapping("/documents/{documentId}/figures")
  public ResponseEntity<List<FigureResponse>> getDocumentFigures(
      @PathVariable Long documentId, @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    return ResponseEntity.ok(
        documentService.getDocumentFigures(documentId, user).stream()
            .map(FigureResponse::fromEntity)
            .toList());
  }

  @GetMapping("/sections/{sectionId}/figures")
  public ResponseEntity<List<FigureResponse>> getSectionFigures(
      @PathVariable Long sectionId, @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    return ResponseEntity.ok(
        documentService.getSectionFigures(sectionId, user).stream()
            .map(FigureResponse::fromEntity)
            .toList());
  }

  /** Streams the stored PDF. */
  @GetMapping("/documents/{documentId}/pdf")
  public ResponseEntity<Resource> getPdf(@PathVariable Long documentId) {
    StoredPdf pdf = documentService.getPdf(documentId);
    ContentDisposition disposition =
        ContentDisposition.attachment()
            .filename(pdf.originalFilename(), StandardCharsets.UTF_8)
            .build();
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_PDF)
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .body(new FileSystemResource(pdf.path()));
  }
}
