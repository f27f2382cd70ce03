package com.flamingo.ndthub.service.audit;

/**
 * What an audited action was performed on. Any id may be {@code null}.
 *
 * @param manufacturerId manufacturer concerned
 * @param documentId document concerned
 * @param sectionId section concerned
 */
public record AuditTarget(Long manufacturerId, Long documentId, Long sectionId) {

  private static final AuditTarget NONE = new AuditTarget(null, null, null);

  public static AuditTarget none() {
    return NONE;
  }

  public static AuditTarget manufacturer(Long manufacturerId) {
    return new AuditTarget(manufacturerId, null, null);
  }

  public static AuditTarget document(Long documentId) {
    return new AuditTarget(null, documentId, null);
  }

  public static AuditTarget document(Long manufacturerId, Long documentId) {
    return new AuditTarget(manufacturerId, documentId, null);
  }

  public static AuditTarget section(Long sectionId) {
    return new AuditTarget(null, null, sectionId);
  }
}
