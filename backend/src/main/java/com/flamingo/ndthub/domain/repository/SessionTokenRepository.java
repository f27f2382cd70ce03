package com.flamingo.ndthub.domain.repository;

import com.flamingo.ndthub.domain.entity.SessionToken;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for SessionToken entities. */
@Repository
public interface SessionTokenRepository extends JpaRepository<SessionToken, Long> {

  /** Finds a token together with its user. */
  @EntityGraph(attributePaths = "user")
  Optional<SessionToken> findByToken(String token);

  /** Most recently active sessions first. */
  @EntityGraph(attributePaths = "user")
  List<SessionToken> findAllByOrderByLastSeenAtDesc(Pageable pageable);

  /** Revokes every token of a user. */
  @Modifying
  @Query("DELETE FROM SessionToken t WHERE t.user.id = :userId")
  int deleteByUserId(@Param("userId") Long userId);
}
