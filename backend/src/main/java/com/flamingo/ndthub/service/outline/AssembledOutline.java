package com.flamingo.ndthub.service.outline;

import com.flamingo.ndthub.domain.entity.Figure;
import com.flamingo.ndthub.domain.entity.Section;
import java.util.List;

/**
 * Persisted sections and figures of a freshly uploaded document.
 *
 * @param sections saved sections in order
 * @param figures saved figures in order, with section references resolved
 */
public record AssembledOutline(List<Section> sections, List<Figure> figures) {

  public int sectionsCreated() {
    return sections.size();
  }

  public int figuresCreated() {
    return figures.size();
  }
}
