package com.flamingo.ndthub.service.user;

import com.flamingo.ndthub.domain.entity.SessionToken;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.UserRole;
import java.util.List;

/** Service interface for user administration and session reporting. */
public interface UserAdminService {

  /** Gets every user ordered by username. */
  List<User> getAllUsers();

  /**
   * Creates a user with a BCrypt-hashed password.
   *
   * @throws com.flamingo.ndthub.exception.DuplicateUsernameException if the username is taken
   */
  User createUser(String username, String password, UserRole role, boolean active, User actor);

  /**
   * Applies a partial update to a user.
   *
   * @throws com.flamingo.ndthub.exception.UserNotFoundException if the user does not exist
   */
  User updateUser(Long userId, UserChanges changes, User actor);

  /**
   * Gets sessions with the most recent activity first.
   *
   * @param limit requested count; {@code null} means the configured default
   */
  List<SessionToken> getRecentSessions(Integer limit);
}
