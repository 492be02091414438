package com.codeheadsystems.quill.server.model;

/**
 * Why a token was revoked. Stored in the ledger's reason column by its tag.
 */
public enum RevocationReason {
  USER_LOGOUT("user_logout"),
  ADMIN_INVALIDATED("admin_invalidated");

  private final String tag;

  RevocationReason(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
