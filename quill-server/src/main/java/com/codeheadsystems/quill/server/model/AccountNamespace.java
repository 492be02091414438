package com.codeheadsystems.quill.server.model;

import java.util.Arrays;

/**
 * Partition an account lives in. End-users and administrators share the same record shape but
 * have disjoint id and email spaces.
 */
public enum AccountNamespace {
  END_USER("end-user"),
  ADMIN("admin");

  private final String label;

  AccountNamespace(String label) {
    this.label = label;
  }

  /**
   * Wire label, as carried in session tokens and request paths.
   *
   * @return the label
   */
  public String label() {
    return label;
  }

  /**
   * Resolves a namespace from its wire label.
   *
   * @param label {@code end-user} or {@code admin}
   * @return the namespace
   * @throws IllegalArgumentException if the label is unknown
   */
  public static AccountNamespace fromLabel(String label) {
    return Arrays.stream(values())
        .filter(ns -> ns.label.equals(label))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown account namespace: " + label));
  }
}
