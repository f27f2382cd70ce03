package com.flamingo.ndthub.service.document;

import com.flamingo.ndthub.domain.entity.Document;
import com.flamingo.ndthub.domain.entity.Figure;
import com.flamingo.ndthub.domain.entity.Section;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.domain.repository.DocumentRepository;
import com.flamingo.ndthub.domain.repository.FigureRepository;
import com.flamingo.ndthub.domain.repository.SectionRepository;
import com.flamingo.ndthub.exception.DocumentNotFoundException;
import com.flamingo.ndthub.exception.DocumentProcessingException;
import com.flamingo.ndthub.service.audit.AuditService;
import com.flamingo.ndthub.service.audit.AuditTarget;
import com.flamingo.ndthub.service.manufacturer.ManufacturerService;
import com.flamingo.ndthub.service.outline.DocumentOutline;
import com.flamingo.ndthub.service.outline.ExtractedPages;
import com.flamingo.ndthub.service.outline.OutlineDetector;
import com.flamingo.ndthub.service.outline.PdfTextExtractor;
import com.flamingo.ndthub.service.storage.PdfStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/**
 * Implementation of the DocumentService.
 *
 * <p>An upload is extracted before anything is written: the PDF is parsed and its outline
 * detected, then the file is stored and {@link DocumentPersistenceService} commits the document,
 * sections, figures and audit entry together. The stored file is removed again if that commit
 * fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final String PDF_EXTENSION = ".pdf";

  private final DocumentRepository documentRepository;
  private final SectionRepository sectionRepository;
  private final FigureRepository figureRepository;
  private final ManufacturerService manufacturerService;
  private final PdfTextExtractor pdfTextExtractor;
  private final OutlineDetector outlineDetector;
  private final PdfStorageService pdfStorageService;
  private final DocumentPersistenceService documentPersistenceService;
  private final AuditService auditService;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.upload", description = "Time to upload and outline a document")
  public UploadResult uploadDocument(
      Long manufacturerId, DocumentMetadata metadata, MultipartFile file, User uploader) {
    String fileName = file.getOriginalFilename();
    log.info(
        "Uploading document {} for manufacturer {} by {}",
        fileName,
        manufacturerId,
        uploader.getUsername());

    manufacturerService.getManufacturer(manufacturerId);
    validateUpload(metadata, file);

    byte[] pdfBytes = readBytes(file);
    ExtractedPages pages = pdfTextExtractor.extract(pdfBytes, fileName);
    DocumentOutline outline = outlineDetector.detect(pages);

    String storageKey = pdfStorageService.store(pdfBytes, fileName);
    UploadResult result;
    try {
      result =
          documentPersistenceService.createWithOutline(
              manufacturerId, metadata, fileName, storageKey, uploader, outline);
    } catch (RuntimeException e) {
      log.error("Persisting upload of {} failed, removing stored file {}", fileName, storageKey);
      pdfStorageService.delete(storageKey);
      throw e;
    }

    meterRegistry.counter("document.uploaded").increment();
    meterRegistry.counter("outline.sections.detected").increment(result.sectionsCreated());
    meterRegistry.counter("outline.figures.detected").increment(result.figuresCreated());
    log.info(
        "Document {} uploaded with ID {}: {} pages, {} sections{}, {} figures",
        fileName,
        result.document().getId(),
        outline.pageCount(),
        result.sectionsCreated(),
        outline.fallback() ? " (fallback)" : "",
        result.figuresCreated());
    return result;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(Long documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  @Transactional
  public DocumentDetail viewDocument(Long documentId, User viewer) {
    Document document = getDocument(documentId);
    List<Section> sections = sectionRepository.findByDocumentIdOrderByOrderIndexAsc(documentId);
    auditService.record(
        viewer,
        AuditAction.VIEW_DOCUMENT,
        AuditTarget.document(documentId),
        Map.of("sections", sections.size()));
    return new DocumentDetail(document, sections);
  }

  @Override
  @Transactional
  @Timed(value = "document.getByManufacturer", description = "Time to list documents")
  public List<Document> getDocumentsByManufacturer(
      Long manufacturerId, String titleQuery, User viewer) {
    manufacturerService.getManufacturer(manufacturerId);

    List<Document> documents =
        titleQuery == null || titleQuery.isBlank()
            ? documentRepository.findByManufacturerIdOrderByUploadedAtDesc(manufacturerId)
            : documentRepository
                .findByManufacturerIdAndTitleContainingIgnoreCaseOrderByUploadedAtDesc(
                    manufacturerId, titleQuery.strip());

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("count", documents.size());
    if (titleQuery != null && !titleQuery.isBlank()) {
      metadata.put("query", titleQuery.strip());
    }
    auditService.record(
        viewer, AuditAction.VIEW_DOC_LIST, AuditTarget.manufacturer(manufacturerId), metadata);
    return documents;
  }

  @Override
  @Transactional
  public Document updateDocument(Long documentId, DocumentMetadata metadata, User editor) {
    Document document = getDocument(documentId);
    if (hasText(metadata.title())) {
      document.setTitle(metadata.title().strip());
    }
    if (hasText(metadata.revisionDate())) {
      document.setRevisionDate(metadata.revisionDate().strip());
    }
    if (hasText(metadata.tags())) {
      document.setTags(metadata.tags().strip());
    }
    Document saved = documentRepository.save(document);

    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put("title", metadata.title());
    changes.put("revision_date", metadata.revisionDate());
    auditService.record(editor, AuditAction.UPDATE_DOC, AuditTarget.document(documentId), changes);

    log.info("Updated metadata of document {}", documentId);
    return saved;
  }

  @Override
  @Transactional
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(Long documentId, User actor) {
    Document document = getDocument(documentId);
    String storageKey = document.getStorageKey();

    documentRepository.delete(document);
    auditService.record(
        actor,
        AuditAction.DELETE_DOC,
        AuditTarget.document(documentId),
        Map.of("title", document.getTitle()));
    meterRegistry.counter("document.deleted").increment();

    // Only drop the file once the rows are really gone
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              pdfStorageService.delete(storageKey);
            }
          });
    } else {
      pdfStorageService.delete(storageKey);
    }

    log.info("Deleted document: {}", documentId);
  }

  @Override
  @Transactional
  public List<Section> getSections(Long documentId, User viewer) {
    List<Section> sections = sectionRepository.findByDocumentIdOrderByOrderIndexAsc(documentId);
    auditService.record(
        viewer,
        AuditAction.VIEW_SECTION_LIST,
        AuditTarget.document(documentId),
        Map.of("count", sections.size()));
    return sections;
  }

  @Override
  @Transactional
  public List<Figure> getDocumentFigures(Long documentId, User viewer) {
    List<Figure> figures = figureRepository.findByDocumentIdOrderByOrderIndexAsc(documentId);
    auditService.record(
        viewer,
        AuditAction.VIEW_FIGURE_LIST,
        AuditTarget.document(documentId),
        Map.of("count", figures.size()));
    return figures;
  }

  @Override
  @Transactional
  public List<Figure> getSectionFigures(Long sectionId, User viewer) {
    List<Figure> figures = figureRepository.findBySectionIdOrderByOrderIndexAsc(sectionId);
    auditService.record(
        viewer,
        AuditAction.VIEW_SECTION,
        AuditTarget.section(sectionId),
        Map.of("count", figures.size()));
    return figures;
  }

  @Override
  @Transactional(readOnly = true)
  public StoredPdf getPdf(Long documentId) {
    Document document = getDocument(documentId);
    return new StoredPdf(
        pdfStorageService.resolve(document.getStorageKey()), document.getOriginalFilename());
  }

  private void validateUpload(DocumentMetadata metadata, MultipartFile file) {
    String fileName = file.getOriginalFilename();
    if (metadata == null || !hasText(metadata.title())) {
      throw new DocumentProcessingException(fileName, "Title is missing", "Title is required");
    }
    if (fileName == null || !fileName.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION)) {
      throw new DocumentProcessingException(
          fileName, "Rejected non-PDF upload: " + fileName, "Only PDF files allowed");
    }
    if (file.isEmpty()) {
      throw new DocumentProcessingException(fileName, "File is empty", "Please upload a valid PDF");
    }
  }

  private byte[] readBytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          file.getOriginalFilename(), "Failed to read uploaded file: " + e.getMessage(), e);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
