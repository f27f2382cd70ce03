package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.service.document.UploadResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  private DocumentResponse document;
  private int sectionsCreated;
  private int figuresCreated;

  public static UploadResponse from(UploadResult result) {
    return UploadResponse.builder()
        .document(DocumentResponse.fromEntity(result.document()))
        .sectionsCreated(result.sectionsCreated())
        .figuresCreated(result.figuresCreated())
        .build();
  }
}
