package com.flamingo.ndthub.domain.repository;

import com.flamingo.ndthub.domain.entity.Figure;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Figure entities. */
@Repository
public interface FigureRepository extends JpaRepository<Figure, Long> {

  /** Figures attached to a section in detection order. */
  List<Figure> findBySectionIdOrderByOrderIndexAsc(Long sectionId);

  /** All figures of a document in detection order. */
  List<Figure> findByDocumentIdOrderByOrderIndexAsc(Long documentId);

  long countByDocumentId(Long documentId);
}
