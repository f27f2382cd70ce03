package com.flamingo.ndthub.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/** A caption line detected in a document, optionally attached to the section it follows. */
@Entity
@Table(name = "figures")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Figure {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "section_id")
  @OnDelete(action = OnDeleteAction.SET_NULL)
  private Section section;

  private Integer pageNumber;

  @Column(columnDefinition = "TEXT")
  private String captionText;

  /** Reserved for cropped figure images; never set by outline detection. */
  private String imageStorageKey;

  /** 1-based position among the figures of the same document. */
  @Column(nullable = false)
  private int orderIndex;
}
