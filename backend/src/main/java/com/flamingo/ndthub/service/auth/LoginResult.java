package com.flamingo.ndthub.service.auth;

import com.flamingo.ndthub.domain.entity.User;

/**
 * Outcome of a successful login.
 *
 * @param token the bearer token to send on later requests
 * @param user the authenticated user
 */
public record LoginResult(String token, User user) {}
