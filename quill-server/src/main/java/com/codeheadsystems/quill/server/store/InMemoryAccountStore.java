package com.codeheadsystems.quill.server.store;

import com.codeheadsystems.quill.server.model.Account;
import com.codeheadsystems.quill.server.model.AccountNamespace;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AccountStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Accounts are seeded with {@link #save(Account)} and lost on restart. Suitable for development
 * and integration testing only.
 */
public class InMemoryAccountStore implements AccountStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAccountStore.class);

  private record AccountKey(AccountNamespace namespace, long id) {
  }

  private final ConcurrentHashMap<AccountKey, Account> accounts = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryAccountStore() {
    this(Clock.systemUTC());
  }

  public InMemoryAccountStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryAccountStore, accounts will NOT survive restarts. "
        + "Replace with a persistent AccountStore for production.");
  }

  /**
   * Stores or replaces an account.
   *
   * @param account the account
   */
  public void save(Account account) {
    accounts.put(new AccountKey(account.namespace(), account.id()), account);
    log.debug("Saved account id={} namespace={}", account.id(), account.namespace());
  }

  @Override
  public Optional<Account> findByUsername(AccountNamespace namespace, String username) {
    return accounts.values().stream()
        .filter(a -> a.namespace() == namespace && a.username().equals(username))
        .findFirst();
  }

  @Override
  public Optional<Account> findByEmail(AccountNamespace namespace, String email) {
    return accounts.values().stream()
        .filter(a -> a.namespace() == namespace && a.email().equalsIgnoreCase(email))
        .findFirst();
  }

  @Override
  public Optional<Account> findById(AccountNamespace namespace, long id) {
    return Optional.ofNullable(accounts.get(new AccountKey(namespace, id)));
  }

  @Override
  public void updateLastLogin(AccountNamespace namespace, long id) {
    accounts.computeIfPresent(new AccountKey(namespace, id),
        (k, account) -> account.withLastLoginAt(clock.instant()));
  }
}
