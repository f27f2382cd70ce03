package com.flamingo.ndthub.service.user;

import com.flamingo.ndthub.domain.enums.UserRole;

/**
 * Partial update of a user; {@code null} fields are left unchanged.
 *
 * @param role new role
 * @param password new plain-text password
 * @param active new active flag
 */
public record UserChanges(UserRole role, String password, Boolean active) {}
