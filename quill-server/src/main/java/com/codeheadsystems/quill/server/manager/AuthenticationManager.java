package com.codeheadsystems.quill.server.manager;

import com.codeheadsystems.quill.server.auth.AuthFailure;
import com.codeheadsystems.quill.server.auth.AuthFailureException;
import com.codeheadsystems.quill.server.auth.PasswordHasher;
import com.codeheadsystems.quill.server.auth.SessionTokenManager;
import com.codeheadsystems.quill.server.model.Account;
import com.codeheadsystems.quill.server.model.AccountNamespace;
import com.codeheadsystems.quill.server.model.AccountView;
import com.codeheadsystems.quill.server.model.RevocationReason;
import com.codeheadsystems.quill.server.model.SessionIdentity;
import com.codeheadsystems.quill.server.revocation.RevocationCache;
import com.codeheadsystems.quill.server.store.AccountStore;
import com.codeheadsystems.quill.server.store.StoreUnavailableException;
import java.util.Collection;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic login, logout and per-request authentication.
 * <p>
 * Framework adapters stay thin: they call into this class and translate exceptions.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}: missing identifier, password or namespace → HTTP 400</li>
 *   <li>{@link AuthFailureException}: bad credentials, unknown or disabled account, bad token
 *                                            → HTTP 401; role mismatch → HTTP 403</li>
 *   <li>{@link StoreUnavailableException}: credential store or revocation ledger unreachable,
 *                                            retryable → HTTP 503</li>
 * </ul>
 */
@Singleton
public class AuthenticationManager {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationManager.class);

  /**
   * Compared against when the account does not exist, so a miss costs one hash like a hit.
   */
  private static final String ABSENT_ACCOUNT_PASSWORD = "absent-account-password";

  private final AccountStore accountStore;
  private final PasswordHasher passwordHasher;
  private final SessionTokenManager tokenManager;
  private final RevocationCache revocationCache;
  private final String absentAccountHash;

  @Inject
  public AuthenticationManager(AccountStore accountStore,
                               PasswordHasher passwordHasher,
                               SessionTokenManager tokenManager,
                               RevocationCache revocationCache) {
    this.accountStore = accountStore;
    this.passwordHasher = passwordHasher;
    this.tokenManager = tokenManager;
    this.revocationCache = revocationCache;
    this.absentAccountHash = passwordHasher.hash(ABSENT_ACCOUNT_PASSWORD);
  }

  // ── Login / logout ────────────────────────────────────────────────────────

  /**
   * Verifies credentials and issues a session token.
   * <p>
   * The identifier is treated as an email when it contains {@code @}, otherwise as a username.
   * A disabled account is rejected before its password is checked.
   *
   * @param namespace  end-user or admin
   * @param identifier username or email
   * @param password   plaintext password
   * @return the token and the sanitized account
   * @throws IllegalArgumentException  if any argument is missing
   * @throws AuthFailureException      {@code ACCOUNT_NOT_FOUND}, {@code ACCOUNT_DISABLED} or
   *                                   {@code BAD_CREDENTIALS}
   * @throws StoreUnavailableException if the account store cannot be read
   */
  public LoginResult login(AccountNamespace namespace, String identifier, String password) {
    if (namespace == null) {
      throw new IllegalArgumentException("Missing required field: namespace");
    }
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Missing required field: identifier");
    }
    if (password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    log.debug("login(namespace={}, identifier={})", namespace.label(), identifier);

    Optional<Account> found = identifier.contains("@")
        ? accountStore.findByEmail(namespace, identifier)
        : accountStore.findByUsername(namespace, identifier);
    if (found.isEmpty()) {
      passwordHasher.verify(password, absentAccountHash);
      log.info("Login failed for {} in {}: no such account", identifier, namespace.label());
      throw new AuthFailureException(AuthFailure.ACCOUNT_NOT_FOUND);
    }
    Account account = found.get();
    if (!account.enabled()) {
      log.info("Login failed for account id={} in {}: disabled", account.id(), namespace.label());
      throw new AuthFailureException(AuthFailure.ACCOUNT_DISABLED);
    }
    if (!passwordHasher.verify(password, account.passwordHash())) {
      log.info("Login failed for account id={} in {}: password mismatch", account.id(), namespace.label());
      throw new AuthFailureException(AuthFailure.BAD_CREDENTIALS);
    }

    touchLastLogin(account);
    String token = tokenManager.issue(account);
    log.info("Login succeeded for account id={} in {} (role={})", account.id(), namespace.label(), account.role());
    return new LoginResult(token, account.toView());
  }

  /**
   * Revokes a session token on behalf of its holder. Malformed, forged or already expired tokens
   * are accepted as a no-op.
   *
   * @param token the bearer token
   * @throws StoreUnavailableException if the revocation could not be made durable; the token
   *                                   stays valid and the caller should retry
   */
  public void logout(String token) {
    revoke(token, RevocationReason.USER_LOGOUT);
  }

  /**
   * Revokes a session token with an explicit reason, e.g. when an administrator invalidates
   * someone else's session.
   *
   * @param token  the bearer token
   * @param reason why it is revoked
   * @throws StoreUnavailableException if the revocation could not be made durable
   */
  public void revoke(String token, RevocationReason reason) {
    Optional<SessionIdentity> identity = tokenManager.verify(token);
    if (identity.isEmpty()) {
      log.debug("revoke(): token invalid or already expired, nothing to do");
      return;
    }
    SessionIdentity session = identity.get();
    revocationCache.revoke(token, session.subjectId(), session.expiresAt(), reason.tag());
    log.info("Session revoked for account id={} in {} ({})",
        session.subjectId(), session.namespace().label(), reason.tag());
  }

  // ── Per-request authentication ────────────────────────────────────────────

  /**
   * Authenticates a bearer token: signature, expiry, then revocation.
   *
   * @param token the bearer token
   * @return the identity carried by the token
   * @throws AuthFailureException {@code UNAUTHORIZED}, whichever check failed
   */
  public SessionIdentity authenticate(String token) {
    Optional<SessionIdentity> identity = tokenManager.verify(token);
    if (identity.isEmpty()) {
      log.debug("authenticate(): signature, structure or expiry check failed");
      throw new AuthFailureException(AuthFailure.UNAUTHORIZED);
    }
    if (revocationCache.isRevoked(token)) {
      log.debug("authenticate(): token revoked for account id={}", identity.get().subjectId());
      throw new AuthFailureException(AuthFailure.UNAUTHORIZED);
    }
    return identity.get();
  }

  /**
   * Checks that the identity holds one of the allowed roles. An empty collection allows any role.
   *
   * @param identity     the authenticated identity
   * @param allowedRoles role labels that may proceed
   * @throws AuthFailureException {@code FORBIDDEN} if the role is not allowed
   */
  public void requireRole(SessionIdentity identity, Collection<String> allowedRoles) {
    if (allowedRoles == null || allowedRoles.isEmpty()) {
      return;
    }
    if (identity == null || !allowedRoles.contains(identity.role())) {
      throw new AuthFailureException(AuthFailure.FORBIDDEN);
    }
  }

  /**
   * Loads an account without its password hash.
   *
   * @param id        account id
   * @param namespace the namespace
   * @return the view, or empty if there is no such account
   * @throws StoreUnavailableException if the account store cannot be read
   */
  public Optional<AccountView> getSafeAccountView(long id, AccountNamespace namespace) {
    return accountStore.findById(namespace, id).map(Account::toView);
  }

  private void touchLastLogin(Account account) {
    try {
      accountStore.updateLastLogin(account.namespace(), account.id());
    } catch (RuntimeException e) {
      log.warn("Unable to update last login for account id={} in {}, continuing: {}",
          account.id(), account.namespace().label(), e.getMessage());
    }
  }
}
