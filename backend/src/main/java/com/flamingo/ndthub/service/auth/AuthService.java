package com.flamingo.ndthub.service.auth;

import com.flamingo.ndthub.domain.entity.User;

/** Service interface for password login and bearer-token sessions. */
public interface AuthService {

  /**
   * Verifies credentials and issues a new session token.
   *
   * @param username the username
   * @param password the plain-text password
   * @param ip client address, may be null
   * @param userAgent client user agent, may be null
   * @return the issued token and its user
   * @throws com.flamingo.ndthub.exception.UnauthorizedException if the credentials are wrong
   * @throws com.flamingo.ndthub.exception.ForbiddenException if the user is inactive
   */
  LoginResult login(String username, String password, String ip, String userAgent);

  /**
   * Resolves a bearer token to its user and records the request on the session.
   *
   * @param token the raw token
   * @param path the request path being served
   * @return the active user owning the token
   * @throws com.flamingo.ndthub.exception.UnauthorizedException if the token is unknown or its
   *     user is inactive
   */
  User authenticate(String token, String path);

  /** Revokes every session token of the user. */
  void logout(User user);
}
