package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.domain.entity.Section;
import com.flamingo.ndthub.domain.enums.HeadingLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a detected section. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionResponse {

  private Long id;
  private Long documentId;
  private String headingText;
  private HeadingLevel headingLevel;
  private Integer pageStart;
  private Integer pageEnd;
  private int orderIndex;

  public static SectionResponse fromEntity(Section section) {
    return SectionResponse.builder()
        .id(section.getId())
        .documentId(section.getDocument().getId())
        .headingText(section.getHeadingText())
        .headingLevel(section.getHeadingLevel())
        .pageStart(section.getPageStart())
        .pageEnd(section.getPageEnd())
        .orderIndex(section.getOrderIndex())
        .build();
  }
}
