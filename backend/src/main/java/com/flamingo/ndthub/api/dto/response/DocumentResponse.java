package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.domain.entity.Document;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document metadata. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private Long id;
  private Long manufacturerId;
  private String title;
  private String originalFilename;
  private Long uploadedBy;
  private LocalDateTime uploadedAt;
  private String revisionDate;
  private String tags;

  /** Creates a DocumentResponse from a Document entity. Reads only ids of lazy associations. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .manufacturerId(
            document.getManufacturer() == null ? null : document.getManufacturer().getId())
        .title(document.getTitle())
        .originalFilename(document.getOriginalFilename())
        .uploadedBy(document.getUploadedBy() == null ? null : document.getUploadedBy().getId())
        .uploadedAt(document.getUploadedAt())
        .revisionDate(document.getRevisionDate())
        .tags(document.getTags())
        .build();
  }
}
