package com.codeheadsystems.quill.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for Quill authentication.
 * <p>
 * For production, supply {@code jwtSecretHex} (a hex-encoded random value of at least 32 bytes) so
 * that tokens survive restarts, and a {@code database} block so that revocations and accounts are
 * persistent. Omitting the database falls back to in-memory stores (dev/test only).
 * <p>
 * Generate the secret with: {@code openssl rand -hex 32}
 */
public class QuillConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for session tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Session token time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 86400;

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "quill";

  /**
   * bcrypt work factor for password hashes.
   */
  @Min(4)
  @Max(31)
  private int bcryptCost = 10;

  /**
   * Seconds between purges of expired revocation records.
   */
  @Min(1)
  private long revocationSweepIntervalSeconds = 86400;

  /**
   * Confirm revocation cache misses against the ledger. Required when more than one instance
   * shares the ledger.
   */
  private boolean confirmRevocationMisses = true;

  /**
   * Database holding {@code token_blacklist} and the user tables. Null means in-memory stores.
   */
  @Valid
  private DataSourceFactory database;

  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public int getBcryptCost() {
    return bcryptCost;
  }

  @JsonProperty
  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }

  @JsonProperty
  public long getRevocationSweepIntervalSeconds() {
    return revocationSweepIntervalSeconds;
  }

  @JsonProperty
  public void setRevocationSweepIntervalSeconds(long revocationSweepIntervalSeconds) {
    this.revocationSweepIntervalSeconds = revocationSweepIntervalSeconds;
  }

  @JsonProperty
  public boolean isConfirmRevocationMisses() {
    return confirmRevocationMisses;
  }

  @JsonProperty
  public void setConfirmRevocationMisses(boolean confirmRevocationMisses) {
    this.confirmRevocationMisses = confirmRevocationMisses;
  }

  /**
   * Gets the database factory.
   *
   * @return the factory, or null when no database is configured
   */
  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }
}
