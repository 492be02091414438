package com.codeheadsystems.quill.dropwizard;

import com.codeheadsystems.quill.dropwizard.auth.QuillAuthenticator;
import com.codeheadsystems.quill.dropwizard.auth.QuillAuthorizer;
import com.codeheadsystems.quill.dropwizard.auth.QuillPrincipal;
import com.codeheadsystems.quill.dropwizard.health.RevocationCacheHealthCheck;
import com.codeheadsystems.quill.dropwizard.lifecycle.ManagedRevocationSweeper;
import com.codeheadsystems.quill.dropwizard.resource.SessionResource;
import com.codeheadsystems.quill.server.auth.BcryptPasswordHasher;
import com.codeheadsystems.quill.server.auth.SessionTokenManager;
import com.codeheadsystems.quill.server.manager.AuthenticationManager;
import com.codeheadsystems.quill.server.revocation.RevocationCache;
import com.codeheadsystems.quill.server.revocation.RevocationSweeper;
import com.codeheadsystems.quill.server.store.AccountStore;
import com.codeheadsystems.quill.server.store.InMemoryAccountStore;
import com.codeheadsystems.quill.server.store.InMemoryRevocationLedger;
import com.codeheadsystems.quill.server.store.JdbcAccountStore;
import com.codeheadsystems.quill.server.store.JdbcRevocationLedger;
import com.codeheadsystems.quill.server.store.RevocationLedger;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.db.ManagedDataSource;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.dalesbred.Database;
import org.glassfish.jersey.server.filter.RolesAllowedDynamicFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires Quill authentication into an existing Dropwizard application.
 * <p>
 * Registers the session resource, the bearer-token auth filter with {@code @RolesAllowed}
 * support, the revocation-cache health check and the periodic revocation sweep. Requires a
 * {@link QuillConfiguration} block in the application's YAML config.
 * <p>
 * Accounts and revocations live in the configured {@code database}:
 * <pre>{@code
 *   bootstrap.addBundle(new QuillBundle<>());
 * }</pre>
 * <p>
 * Or supply the account store and keep revocations in the configured database:
 * <pre>{@code
 *   bootstrap.addBundle(new QuillBundle<>(myAccountStore));
 * }</pre>
 * Without a {@code database} block everything not supplied is held in memory (dev/test only).
 * <p>
 * The {@link AuthenticationManager} is available from {@link #authenticationManager()} once the
 * bundle has run, for application code that revokes sessions administratively.
 */
public class QuillBundle<C extends QuillConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(QuillBundle.class);

  private final AccountStore suppliedAccountStore;
  private AuthenticationManager authenticationManager;

  /**
   * Creates a bundle whose stores are built from the configuration.
   */
  public QuillBundle() {
    this(null);
  }

  /**
   * Creates a bundle with a caller-supplied account store.
   *
   * @param accountStore the account store, or null to build one from the configuration
   */
  public QuillBundle(AccountStore accountStore) {
    this.suppliedAccountStore = accountStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    Database database = buildDatabase(configuration, environment);
    AccountStore accountStore = buildAccountStore(database);
    RevocationLedger ledger = database == null
        ? new InMemoryRevocationLedger()
        : new JdbcRevocationLedger(database);

    RevocationCache revocationCache = new RevocationCache(ledger, Clock.systemUTC(),
        configuration.isConfirmRevocationMisses());
    revocationCache.initialize();

    authenticationManager = new AuthenticationManager(
        accountStore,
        new BcryptPasswordHasher(configuration.getBcryptCost()),
        buildTokenManager(configuration),
        revocationCache);

    environment.jersey().register(new SessionResource(authenticationManager));
    environment.healthChecks().register("revocation-cache", new RevocationCacheHealthCheck(revocationCache));
    environment.lifecycle().manage(new ManagedRevocationSweeper(new RevocationSweeper(
        revocationCache, Duration.ofSeconds(configuration.getRevocationSweepIntervalSeconds()))));

    // Bearer auth filter
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<QuillPrincipal>()
            .setAuthenticator(new QuillAuthenticator(authenticationManager))
            .setAuthorizer(new QuillAuthorizer(authenticationManager))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(RolesAllowedDynamicFeature.class);
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(QuillPrincipal.class));
  }

  /**
   * The manager built by {@link #run}.
   *
   * @return the authentication manager
   * @throws IllegalStateException if the bundle has not run yet
   */
  public AuthenticationManager authenticationManager() {
    if (authenticationManager == null) {
      throw new IllegalStateException("QuillBundle has not been run yet");
    }
    return authenticationManager;
  }

  private Database buildDatabase(C configuration, Environment environment) {
    DataSourceFactory factory = configuration.getDatabase();
    if (factory == null) {
      log.warn("""
          #################################################################
          # WARNING: No database configured. Revocations (and accounts,   #
          # unless supplied) are held in memory and lost on restart.      #
          # Do not use in production.                                     #
          #################################################################
          """);
      return null;
    }
    ManagedDataSource dataSource = factory.build(environment.metrics(), "quill");
    environment.lifecycle().manage(dataSource);
    return Database.forDataSource(dataSource);
  }

  private AccountStore buildAccountStore(Database database) {
    if (suppliedAccountStore != null) {
      return suppliedAccountStore;
    }
    return database == null ? new InMemoryAccountStore() : new JdbcAccountStore(database);
  }

  private SessionTokenManager buildTokenManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new SessionTokenManager(secret, configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getJwtTtlSeconds()));
  }
}
