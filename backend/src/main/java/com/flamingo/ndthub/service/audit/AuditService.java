package com.flamingo.ndthub.service.audit;

import com.flamingo.ndthub.domain.entity.AuditLog;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.AuditAction;
import java.util.List;
import java.util.Map;

/** Service interface for the audit trail. */
public interface AuditService {

  /**
   * Records an action in the current transaction.
   *
   * @param actor user who performed the action
   * @param action kind of action
   * @param target ids the action concerned
   * @param metadata details serialized as JSON; may be empty
   * @return the saved entry
   */
  AuditLog record(User actor, AuditAction action, AuditTarget target, Map<String, ?> metadata);

  /**
   * Gets the most recent entries, newest first.
   *
   * @param limit requested count; {@code null} means the configured default, larger values are
   *     capped at the configured maximum
   * @return audit entries
   */
  List<AuditLog> getRecent(Integer limit);
}
