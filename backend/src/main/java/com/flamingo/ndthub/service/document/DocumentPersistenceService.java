package com.flamingo.ndthub.service.document;

import com.flamingo.ndthub.domain.entity.Document;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.domain.repository.DocumentRepository;
import com.flamingo.ndthub.domain.repository.ManufacturerRepository;
import com.flamingo.ndthub.domain.repository.UserRepository;
import com.flamingo.ndthub.service.audit.AuditService;
import com.flamingo.ndthub.service.audit.AuditTarget;
import com.flamingo.ndthub.service.outline.AssembledOutline;
import com.flamingo.ndthub.service.outline.DocumentOutline;
import com.flamingo.ndthub.service.outline.OutlineAssembler;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write side of an upload: document row, outline and audit entry in a single transaction.
 *
 * <p>Called only after the PDF has been parsed successfully, so a failure here rolls back
 * everything and no orphan document can remain.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentPersistenceService {

  private final DocumentRepository documentRepository;
  private final ManufacturerRepository manufacturerRepository;
  private final UserRepository userRepository;
  private final OutlineAssembler outlineAssembler;
  private final AuditService auditService;

  @Transactional
  public UploadResult createWithOutline(
      Long manufacturerId,
      DocumentMetadata metadata,
      String originalFilename,
      String storageKey,
      User uploader,
      DocumentOutline outline) {

    Document document =
        Document.builder()
            .manufacturer(manufacturerRepository.getReferenceById(manufacturerId))
            .title(metadata.title().strip())
            .originalFilename(originalFilename)
            .storageKey(storageKey)
            .uploadedBy(userRepository.getReferenceById(uploader.getId()))
            .revisionDate(blankToNull(metadata.revisionDate()))
            .tags(blankToNull(metadata.tags()))
            .build();
    Document saved = documentRepository.saveAndFlush(document);

    AssembledOutline assembled = outlineAssembler.assemble(saved, outline);

    Map<String, Object> counts = new LinkedHashMap<>();
    counts.put("sections_created", assembled.sectionsCreated());
    counts.put("figures_created", assembled.figuresCreated());
    auditService.record(
        uploader,
        AuditAction.UPLOAD_DOC,
        AuditTarget.document(manufacturerId, saved.getId()),
        counts);

    log.debug(
        "Document {} persisted with {} sections and {} figures",
        saved.getId(),
        assembled.sectionsCreated(),
        assembled.figuresCreated());
    return new UploadResult(saved, assembled.sectionsCreated(), assembled.figuresCreated());
  }

  static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }
}
