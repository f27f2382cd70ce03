package com.flamingo.ndthub.domain.enums;

/** Kinds of user actions recorded in the audit trail. */
public enum AuditAction {
  LOGIN,
  LOGOUT,
  VIEW_DOC_LIST,
  VIEW_DOCUMENT,
  UPLOAD_DOC,
  UPDATE_DOC,
  DELETE_DOC,
  VIEW_SECTION_LIST,
  VIEW_FIGURE_LIST,
  VIEW_SECTION,
  SEARCH_TOOL,
  CREATE_USER,
  UPDATE_USER
}
