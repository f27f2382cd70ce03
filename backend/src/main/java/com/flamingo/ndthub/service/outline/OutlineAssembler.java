package com.flamingo.ndthub.service.outline;

import com.flamingo.ndthub.domain.entity.Document;
import com.flamingo.ndthub.domain.entity.Figure;
import com.flamingo.ndthub.domain.entity.Section;
import com.flamingo.ndthub.domain.repository.FigureRepository;
import com.flamingo.ndthub.domain.repository.SectionRepository;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists a detected outline under a document.
 *
 * <p>Sections are saved and flushed first so that they have identities; each figure's detection
 * index is then resolved to the saved section before figures are saved. Must run inside the upload
 * transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutlineAssembler {

  private final SectionRepository sectionRepository;
  private final FigureRepository figureRepository;

  @Transactional(propagation = Propagation.MANDATORY)
  public AssembledOutline assemble(Document document, DocumentOutline outline) {
    List<Section> sections = new ArrayList<>(outline.sections().size());
    for (DetectedSection detected : outline.sections()) {
      sections.add(
          Section.builder()
              .document(document)
              .headingText(detected.headingText())
              .headingLevel(detected.headingLevel())
              .pageStart(detected.pageStart())
              .pageEnd(detected.pageEnd())
              .orderIndex(detected.orderIndex())
              .build());
    }
    List<Section> savedSections = sectionRepository.saveAllAndFlush(sections);

    List<Figure> figures = new ArrayList<>(outline.figures().size());
    for (DetectedFigure detected : outline.figures()) {
      figures.add(
          Figure.builder()
              .document(document)
              .section(resolveSection(detected, savedSections))
              .pageNumber(detected.pageNumber())
              .captionText(detected.captionText())
              .orderIndex(detected.orderIndex())
              .build());
    }
    List<Figure> savedFigures = figureRepository.saveAll(figures);

    document.getSections().addAll(savedSections);
    document.getFigures().addAll(savedFigures);

    log.debug(
        "Persisted {} sections and {} figures for document {}",
        savedSections.size(),
        savedFigures.size(),
        document.getId());
    return new AssembledOutline(savedSections, savedFigures);
  }

  private Section resolveSection(DetectedFigure figure, List<Section> savedSections) {
    if (!figure.hasSection() || figure.sectionIndex() >= savedSections.size()) {
      return null;
    }
    return savedSections.get(figure.sectionIndex());
  }
}
