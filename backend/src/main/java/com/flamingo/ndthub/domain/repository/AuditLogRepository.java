package com.flamingo.ndthub.domain.repository;

import com.flamingo.ndthub.domain.entity.AuditLog;
import com.flamingo.ndthub.domain.enums.AuditAction;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for AuditLog entities. */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

  /** Newest entries first. */
  List<AuditLog> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

  List<AuditLog> findByDocumentIdAndActionType(Long documentId, AuditAction actionType);
}
