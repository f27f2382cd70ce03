package com.flamingo.ndthub.service.document;

import com.flamingo.ndthub.domain.entity.Document;
import com.flamingo.ndthub.domain.entity.Figure;
import com.flamingo.ndthub.domain.entity.Section;
import com.flamingo.ndthub.domain.entity.User;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for document management and outline browsing. */
public interface DocumentService {

  /**
   * Uploads a PDF, extracts its outline and persists document, sections and figures atomically.
   *
   * @param manufacturerId the owning manufacturer
   * @param metadata title (required), revision date and tags
   * @param file the uploaded PDF
   * @param uploader the admin performing the upload
   * @return the created document with section and figure counts
   * @throws com.flamingo.ndthub.exception.DocumentProcessingException if the file is rejected or
   *     is not a readable PDF; nothing is persisted in that case
   */
  UploadResult uploadDocument(
      Long manufacturerId, DocumentMetadata metadata, MultipartFile file, User uploader);

  /**
   * Gets a document by ID.
   *
   * @param documentId the document ID
   * @return the document
   * @throws com.flamingo.ndthub.exception.DocumentNotFoundException if not found
   */
  Document getDocument(Long documentId);

  /**
   * Gets a document with its sections and records the view.
   *
   * @param documentId the document ID
   * @param viewer the requesting user
   * @return the document detail
   */
  DocumentDetail viewDocument(Long documentId, User viewer);

  /**
   * Gets the documents of a manufacturer, newest first, and records the view.
   *
   * @param manufacturerId the manufacturer ID
   * @param titleQuery optional case-insensitive title filter
   * @param viewer the requesting user
   * @return list of documents
   */
  List<Document> getDocumentsByManufacturer(Long manufacturerId, String titleQuery, User viewer);

  /**
   * Replaces the non-blank metadata fields of a document. Never re-runs extraction.
   *
   * @param documentId the document ID
   * @param metadata new values
   * @param editor the admin performing the edit
   * @return the updated document
   */
  Document updateDocument(Long documentId, DocumentMetadata metadata, User editor);

  /**
   * Deletes a document with its sections and figures; the stored PDF is removed after commit.
   *
   * @param documentId the document ID
   * @param actor the admin performing the deletion
   */
  void deleteDocument(Long documentId, User actor);

  /** Gets the sections of a document by order index and records the view. */
  List<Section> getSections(Long documentId, User viewer);

  /** Gets every figure of a document by order index and records the view. */
  List<Figure> getDocumentFigures(Long documentId, User viewer);

  /** Gets the figures attached to a section by order index and records the view. */
  List<Figure> getSectionFigures(Long sectionId, User viewer);

  /**
   * Locates the stored PDF of a document.
   *
   * @throws com.flamingo.ndthub.exception.StoredFileMissingException if the file is gone
   */
  StoredPdf getPdf(Long documentId);
}
