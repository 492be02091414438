package com.codeheadsystems.quill.server.auth;

import java.security.SecureRandom;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PasswordHasher} producing OpenBSD bcrypt strings ({@code $2y$cost$...}).
 * <p>
 * Existing {@code $2a$} and {@code $2b$} hashes verify as well, so stores written by other bcrypt
 * implementations keep working.
 */
@Singleton
public class BcryptPasswordHasher implements PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(BcryptPasswordHasher.class);

  /**
   * Cost factor used when none is configured.
   */
  public static final int DEFAULT_COST = 10;

  private static final int SALT_LENGTH = 16;
  private static final int MIN_COST = 4;
  private static final int MAX_COST = 31;

  private final int cost;
  private final SecureRandom random;

  @Inject
  public BcryptPasswordHasher() {
    this(DEFAULT_COST);
  }

  /**
   * Creates a hasher with the given work factor.
   *
   * @param cost log2 of the bcrypt iteration count, 4 to 31
   */
  public BcryptPasswordHasher(int cost) {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("bcrypt cost must be between " + MIN_COST + " and " + MAX_COST);
    }
    this.cost = cost;
    this.random = new SecureRandom();
    log.info("BcryptPasswordHasher(cost={})", cost);
  }

  @Override
  public String hash(String plaintext) {
    if (plaintext == null || plaintext.isEmpty()) {
      throw new IllegalArgumentException("Password must not be empty");
    }
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    return OpenBSDBCrypt.generate(plaintext.toCharArray(), salt, cost);
  }

  @Override
  public boolean verify(String plaintext, String hashed) {
    if (plaintext == null || hashed == null || hashed.isEmpty()) {
      return false;
    }
    try {
      return OpenBSDBCrypt.checkPassword(hashed, plaintext.toCharArray());
    } catch (IllegalArgumentException | DataLengthException e) {
      log.debug("Stored password hash is not a valid bcrypt string: {}", e.getMessage());
      return false;
    }
  }
}
