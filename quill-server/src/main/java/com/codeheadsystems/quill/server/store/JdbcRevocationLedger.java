package com.codeheadsystems.quill.server.store;

import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.dalesbred.Database;
import org.dalesbred.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RevocationLedger} backed by the {@code token_blacklist} table.
 * <p>
 * The table is keyed by a surrogate id with secondary indexes on the SHA-256 of the token and on
 * the expiry column, so lookups stay indexed whatever the token length and purges are range
 * deletes. Lookups match the digest and then the full token value. The table is created on first
 * use if it does not exist yet, and a table left by an older layout (a 512 character token column
 * with no digest column) is widened and backfilled in place.
 * <p>
 * Expiries are stored as UTC wall-clock {@code DATETIME} values. They are bound as literals and
 * read back as {@link LocalDateTime}, so neither the JVM default zone nor the driver's session
 * zone takes part in the conversion.
 * <p>
 * Every {@link DatabaseException} is rethrown as {@link StoreUnavailableException}.
 */
@Singleton
public class JdbcRevocationLedger implements RevocationLedger {

  /**
   * Widest token the table accepts. Session tokens carry the username and e-mail claims, so this
   * leaves room for the longest values the account tables allow.
   */
  public static final int TOKEN_MAX_LENGTH = 2048;

  private static final Logger log = LoggerFactory.getLogger(JdbcRevocationLedger.class);

  static final String CREATE_TABLE = """
      CREATE TABLE IF NOT EXISTS token_blacklist (
        id BIGINT NOT NULL AUTO_INCREMENT,
        token VARCHAR(2048) NOT NULL,
        token_hash CHAR(64) NOT NULL,
        user_id BIGINT NOT NULL,
        expiry_date DATETIME NOT NULL,
        reason VARCHAR(50) NOT NULL DEFAULT 'user_logout',
        created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
        PRIMARY KEY (id),
        INDEX idx_token_blacklist_token_hash (token_hash),
        INDEX idx_token_blacklist_expiry (expiry_date)
      )""";

  /** Token indexes created by older layouts. A full index on the token blocks widening it. */
  private static final List<String> LEGACY_TOKEN_INDEXES = List.of("idx_token_blacklist_token", "idx_token");

  private static final DateTimeFormatter UTC_WALL_CLOCK =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  private final Database database;
  private volatile boolean schemaReady;

  @Inject
  public JdbcRevocationLedger(Database database) {
    this.database = database;
  }

  @Override
  public void initialize() {
    try {
      database.update(CREATE_TABLE);
      upgradeLegacyLayout(database.executeQuery(rs -> readLayout(rs.getMetaData()),
          "SELECT * FROM token_blacklist WHERE 1 = 0"));
      schemaReady = true;
      log.info("token_blacklist table checked/created");
    } catch (DatabaseException e) {
      throw new StoreUnavailableException("Unable to create token_blacklist table", e);
    }
  }

  /**
   * Durably records a revoked token.
   *
   * @throws IllegalArgumentException if the token is longer than {@link #TOKEN_MAX_LENGTH}. This
   *                                  is not retryable, unlike {@link StoreUnavailableException}.
   */
  @Override
  public void record(String token, long subjectId, Instant expiresAt, String reason) {
    if (token.length() > TOKEN_MAX_LENGTH) {
      throw new IllegalArgumentException("Token is " + token.length()
          + " characters, the ledger stores at most " + TOKEN_MAX_LENGTH);
    }
    ensureSchema();
    try {
      database.update("INSERT INTO token_blacklist (token, token_hash, user_id, expiry_date, reason) "
              + "VALUES (?, ?, ?, ?, ?)",
          token, tokenHash(token), subjectId, utcWallClock(expiresAt), reason);
    } catch (DatabaseException e) {
      throw new StoreUnavailableException("Unable to record revoked token", e);
    }
  }

  @Override
  public boolean contains(String token) {
    ensureSchema();
    try {
      return database.findUniqueLong(
          "SELECT COUNT(*) FROM token_blacklist WHERE token_hash = ? AND token = ?",
          tokenHash(token), token) > 0;
    } catch (DatabaseException e) {
      throw new StoreUnavailableException("Unable to read token_blacklist", e);
    }
  }

  @Override
  public int purgeExpired(Instant now) {
    ensureSchema();
    try {
      int removed = database.update("DELETE FROM token_blacklist WHERE expiry_date < ?",
          utcWallClock(now));
      log.debug("Purged {} expired revocation record(s)", removed);
      return removed;
    } catch (DatabaseException e) {
      throw new StoreUnavailableException("Unable to purge token_blacklist", e);
    }
  }

  @Override
  public Map<String, Instant> loadActive(Instant now) {
    ensureSchema();
    try {
      List<ActiveRow> rows = database.findAll(JdbcRevocationLedger::readActiveRow,
          "SELECT token, expiry_date FROM token_blacklist WHERE expiry_date > ?",
          utcWallClock(now));
      return rows.stream()
          .collect(Collectors.toMap(ActiveRow::token, ActiveRow::expiresAt, (a, b) -> a.isAfter(b) ? a : b));
    } catch (DatabaseException e) {
      throw new StoreUnavailableException("Unable to load token_blacklist", e);
    }
  }

  private void ensureSchema() {
    if (!schemaReady) {
      initialize();
    }
  }

  private void upgradeLegacyLayout(Layout layout) {
    if (layout.tokenWidth() < TOKEN_MAX_LENGTH) {
      log.info("Widening token_blacklist.token from {} to {} characters", layout.tokenWidth(), TOKEN_MAX_LENGTH);
      LEGACY_TOKEN_INDEXES.forEach(this::dropIndexIfPresent);
      database.update("ALTER TABLE token_blacklist MODIFY token VARCHAR(" + TOKEN_MAX_LENGTH + ") NOT NULL");
    }
    if (!layout.hasTokenHash()) {
      log.info("Adding token_blacklist.token_hash and backfilling existing records");
      database.update("ALTER TABLE token_blacklist ADD COLUMN token_hash CHAR(64) NULL");
      List<LegacyRow> rows = database.findAll(rs -> new LegacyRow(rs.getLong(1), rs.getString(2)),
          "SELECT id, token FROM token_blacklist WHERE token_hash IS NULL");
      for (LegacyRow row : rows) {
        database.update("UPDATE token_blacklist SET token_hash = ? WHERE id = ?", tokenHash(row.token()), row.id());
      }
      database.update("CREATE INDEX idx_token_blacklist_token_hash ON token_blacklist (token_hash)");
      log.info("Backfilled token_hash for {} revocation record(s)", rows.size());
    }
  }

  private void dropIndexIfPresent(String index) {
    try {
      database.update("DROP INDEX " + index + " ON token_blacklist");
      log.info("Dropped legacy index {}", index);
    } catch (DatabaseException e) {
      log.debug("Legacy index {} not dropped: {}", index, e.getMessage());
    }
  }

  static String tokenHash(String token) {
    byte[] input = token.getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  static String utcWallClock(Instant instant) {
    return UTC_WALL_CLOCK.format(instant);
  }

  private static Layout readLayout(ResultSetMetaData metaData) throws SQLException {
    int tokenWidth = Integer.MAX_VALUE;
    boolean hasTokenHash = false;
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      String column = metaData.getColumnLabel(i);
      if ("token".equalsIgnoreCase(column)) {
        tokenWidth = metaData.getPrecision(i);
      } else if ("token_hash".equalsIgnoreCase(column)) {
        hasTokenHash = true;
      }
    }
    return new Layout(tokenWidth, hasTokenHash);
  }

  private static ActiveRow readActiveRow(ResultSet rs) throws SQLException {
    return new ActiveRow(rs.getString(1), rs.getObject(2, LocalDateTime.class).toInstant(ZoneOffset.UTC));
  }

  private record Layout(int tokenWidth, boolean hasTokenHash) {
  }

  private record LegacyRow(long id, String token) {
  }

  private record ActiveRow(String token, Instant expiresAt) {
  }
}
