package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.domain.entity.Figure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a detected figure caption. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FigureResponse {

  private Long id;
  private Long documentId;

  /** Owning section, or {@code null} for figures seen before any heading. */
  private Long sectionId;

  private Integer pageNumber;
  private String captionText;
  private String imageStorageKey;
  private int orderIndex;

  public static FigureResponse fromEntity(Figure figure) {
    return FigureResponse.builder()
        .id(figure.getId())
        .documentId(figure.getDocument().getId())
        .sectionId(figure.getSection() == null ? null : figure.getSection().getId())
        .pageNumber(figure.getPageNumber())
        .captionText(figure.getCaptionText())
        .imageStorageKey(figure.getImageStorageKey())
        .orderIndex(figure.getOrderIndex())
        .build();
  }
}
