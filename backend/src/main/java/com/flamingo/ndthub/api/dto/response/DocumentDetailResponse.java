package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.service.document.DocumentDetail;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document together with its ordered sections. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentDetailResponse {

  private DocumentResponse document;
  private List<SectionResponse> sections;

  public static DocumentDetailResponse from(DocumentDetail detail) {
    return DocumentDetailResponse.builder()
        .document(DocumentResponse.fromEntity(detail.document()))
        .sections(detail.sections().stream().map(SectionResponse::fromEntity).toList())
        .build();
  }
}
