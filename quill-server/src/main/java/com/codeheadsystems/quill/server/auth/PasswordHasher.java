package com.codeheadsystems.quill.server.auth;

/**
 * One-way salted password hashing.
 */
public interface PasswordHasher {

  /**
   * Hashes a password with a fresh random salt.
   *
   * @param plaintext the password
   * @return the encoded hash, salt and cost included
   */
  String hash(String plaintext);

  /**
   * Checks a password against an encoded hash in constant time with respect to where the
   * mismatch occurs. Never throws for a malformed or missing hash.
   *
   * @param plaintext the password
   * @param hashed    the encoded hash
   * @return true only if the password matches
   */
  boolean verify(String plaintext, String hashed);
}
