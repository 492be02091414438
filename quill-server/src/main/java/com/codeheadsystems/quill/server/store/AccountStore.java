package com.codeheadsystems.quill.server.store;

import com.codeheadsystems.quill.server.model.Account;
import com.codeheadsystems.quill.server.model.AccountNamespace;
import java.util.Optional;

/**
 * Read access to end-user and admin account records, plus the last-login touch.
 * <p>
 * Implementations must be thread-safe. "Not found" is always an empty optional; any I/O failure
 * surfaces as {@link StoreUnavailableException}.
 */
public interface AccountStore {

  /**
   * Looks up an account by username within a namespace.
   *
   * @param namespace the namespace to search
   * @param username  the login name
   * @return the account, or empty if none
   */
  Optional<Account> findByUsername(AccountNamespace namespace, String username);

  /**
   * Looks up an account by email within a namespace.
   *
   * @param namespace the namespace to search
   * @param email     the email address
   * @return the account, or empty if none
   */
  Optional<Account> findByEmail(AccountNamespace namespace, String email);

  /**
   * Looks up an account by id within a namespace.
   *
   * @param namespace the namespace to search
   * @param id        the account id
   * @return the account, or empty if none
   */
  Optional<Account> findById(AccountNamespace namespace, long id);

  /**
   * Sets the account's last-login time to now.
   *
   * @param namespace the namespace
   * @param id        the account id
   */
  void updateLastLogin(AccountNamespace namespace, long id);
}
