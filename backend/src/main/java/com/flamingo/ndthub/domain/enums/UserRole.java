package com.flamingo.ndthub.domain.enums;

/** Role of a hub user. */
public enum UserRole {
  /** Can upload, edit and delete documents, manage users and read reports. */
  ADMIN,

  /** Can browse manufacturers, documents, sections and figures. */
  USER
}
