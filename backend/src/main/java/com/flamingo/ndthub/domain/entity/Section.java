package com.flamingo.ndthub.domain.entity;

import com.flamingo.ndthub.domain.enums.HeadingLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

/** A heading detected in a document. */
@Entity
@Table(name = "sections")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Section {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  /** Numeric label and title exactly as found, e.g. {@code "3.2 Inspection Criteria"}. */
  @Column(nullable = false, columnDefinition = "TEXT")
  private String headingText;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  @Builder.Default
  private HeadingLevel headingLevel = HeadingLevel.H1;

  private Integer pageStart;

  private Integer pageEnd;

  /** 1-based position among the sections of the same document. */
  @Column(nullable = false)
  private int orderIndex;
}
