package com.codeheadsystems.quill.server.store;

import com.codeheadsystems.quill.server.model.Account;
import com.codeheadsystems.quill.server.model.AccountNamespace;
import com.codeheadsystems.quill.server.model.AccountStatus;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.dalesbred.Database;
import org.dalesbred.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AccountStore} over the {@code public_users} (end-user) and {@code admin_users} (admin)
 * tables. Admin role labels come from the {@code roles} table; an admin without a role row is
 * labelled {@code admin}.
 * <p>
 * Whether each table has a {@code last_login} column is probed once at construction. When it is
 * missing, reads report no last-login time and {@link #updateLastLogin} does nothing.
 */
@Singleton
public class JdbcAccountStore implements AccountStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcAccountStore.class);

  private static final String DEFAULT_ADMIN_ROLE = "admin";

  private final Database database;
  private final Map<AccountNamespace, Boolean> lastLoginSupported = new EnumMap<>(AccountNamespace.class);

  @Inject
  public JdbcAccountStore(Database database) {
    this.database = database;
    for (AccountNamespace namespace : AccountNamespace.values()) {
      lastLoginSupported.put(namespace, probeLastLoginColumn(tableFor(namespace)));
    }
  }

  @Override
  public Optional<Account> findByUsername(AccountNamespace namespace, String username) {
    return findOne(namespace, "username", username);
  }

  @Override
  public Optional<Account> findByEmail(AccountNamespace namespace, String email) {
    return findOne(namespace, "email", email);
  }

  @Override
  public Optional<Account> findById(AccountNamespace namespace, long id) {
    return findOne(namespace, "id", id);
  }

  @Override
  public void updateLastLogin(AccountNamespace namespace, long id) {
    if (!supportsLastLogin(namespace)) {
      log.debug("{} has no last_login column, skipping update", tableFor(namespace));
      return;
    }
    try {
      database.update("UPDATE " + tableFor(namespace) + " SET last_login = ? WHERE id = ?",
          Timestamp.from(Instant.now()), id);
    } catch (DatabaseException e) {
      throw new StoreUnavailableException("Unable to update last login for " + namespace.label(), e);
    }
  }

  /**
   * Whether the namespace's table carries a {@code last_login} column.
   *
   * @param namespace the namespace
   * @return true if last-login times are read and written
   */
  public boolean supportsLastLogin(AccountNamespace namespace) {
    return lastLoginSupported.getOrDefault(namespace, false);
  }

  private Optional<Account> findOne(AccountNamespace namespace, String column, Object value) {
    String lastLogin = supportsLastLogin(namespace) ? "u.last_login" : "NULL";
    String sql = switch (namespace) {
      case END_USER -> "SELECT u.id, u.username, u.email, u.password, u.status, u.created_at, "
          + lastLogin + " AS last_login, NULL AS role_name FROM public_users u WHERE u." + column + " = ?";
      case ADMIN -> "SELECT u.id, u.username, u.email, u.password, u.status, u.created_at, "
          + lastLogin + " AS last_login, r.name AS role_name FROM admin_users u "
          + "LEFT JOIN roles r ON u.role_id = r.id WHERE u." + column + " = ?";
    };
    try {
      return database.findOptional(rs -> readAccount(namespace, rs), sql, value);
    } catch (DatabaseException e) {
      throw new StoreUnavailableException("Unable to read " + tableFor(namespace), e);
    }
  }

  private boolean probeLastLoginColumn(String table) {
    try {
      boolean present = database.executeQuery(rs -> hasColumn(rs.getMetaData(), "last_login"),
          "SELECT * FROM " + table + " WHERE 1 = 0");
      if (!present) {
        log.warn("{} has no last_login column; last login times will not be recorded", table);
      }
      return present;
    } catch (DatabaseException e) {
      log.warn("Unable to inspect {} for a last_login column: {}", table, e.getMessage());
      return false;
    }
  }

  private static boolean hasColumn(ResultSetMetaData metaData, String column) throws SQLException {
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      if (column.equalsIgnoreCase(metaData.getColumnLabel(i))) {
        return true;
      }
    }
    return false;
  }

  private static Account readAccount(AccountNamespace namespace, ResultSet rs) throws SQLException {
    String role = namespace == AccountNamespace.END_USER
        ? Account.END_USER_ROLE
        : Optional.ofNullable(rs.getString("role_name")).orElse(DEFAULT_ADMIN_ROLE);
    return new Account(
        rs.getLong("id"),
        namespace,
        rs.getString("username"),
        rs.getString("email"),
        rs.getString("password"),
        AccountStatus.fromCode(rs.getInt("status")),
        role,
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_login")));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  private static String tableFor(AccountNamespace namespace) {
    return namespace == AccountNamespace.ADMIN ? "admin_users" : "public_users";
  }
}
