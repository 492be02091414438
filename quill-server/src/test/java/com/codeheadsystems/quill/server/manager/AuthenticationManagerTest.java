package com.codeheadsystems.quill.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.quill.server.auth.AuthFailure;
import com.codeheadsystems.quill.server.auth.AuthFailureException;
import com.codeheadsystems.quill.server.auth.BcryptPasswordHasher;
import com.codeheadsystems.quill.server.auth.PasswordHasher;
import com.codeheadsystems.quill.server.auth.SessionTokenManager;
import com.codeheadsystems.quill.server.model.Account;
import com.codeheadsystems.quill.server.model.AccountNamespace;
import com.codeheadsystems.quill.server.model.AccountStatus;
import com.codeheadsystems.quill.server.model.AccountView;
import com.codeheadsystems.quill.server.model.RevocationReason;
import com.codeheadsystems.quill.server.model.SessionIdentity;
import com.codeheadsystems.quill.server.revocation.RevocationCache;
import com.codeheadsystems.quill.server.store.AccountStore;
import com.codeheadsystems.quill.server.store.InMemoryAccountStore;
import com.codeheadsystems.quill.server.store.InMemoryRevocationLedger;
import com.codeheadsystems.quill.server.store.JdbcRevocationLedger;
import com.codeheadsystems.quill.server.store.RevocationLedger;
import com.codeheadsystems.quill.server.store.StoreUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.dalesbred.Database;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthenticationManagerTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes();
  private static final String PASSWORD = "P@ss1234";

  private final PasswordHasher hasher = new BcryptPasswordHasher(4);
  private final SessionTokenManager tokenManager =
      new SessionTokenManager(SECRET, "test-issuer", Duration.ofHours(24));

  private InMemoryAccountStore accountStore;
  private InMemoryRevocationLedger ledger;
  private RevocationCache revocationCache;
  private AuthenticationManager manager;

  /**
   * Seeds an enabled end-user, a disabled end-user and an admin.
   */
  @BeforeEach
  void setUp() {
    accountStore = new InMemoryAccountStore();
    accountStore.save(account(1, AccountNamespace.END_USER, "alice", AccountStatus.ENABLED, "user"));
    accountStore.save(account(2, AccountNamespace.END_USER, "mallory", AccountStatus.DISABLED, "user"));
    accountStore.save(account(1, AccountNamespace.ADMIN, "root", AccountStatus.ENABLED, "superadmin"));
    ledger = new InMemoryRevocationLedger();
    revocationCache = new RevocationCache(ledger, Clock.systemUTC(), true);
    revocationCache.initialize();
    manager = new AuthenticationManager(accountStore, hasher, tokenManager, revocationCache);
  }

  private Account account(long id, AccountNamespace namespace, String username, AccountStatus status,
                          String role) {
    return new Account(id, namespace, username, username + "@example.com", hasher.hash(PASSWORD),
        status, role, Instant.now(), null);
  }

  // ── login ─────────────────────────────────────────────────────────────────

  @Test
  void login_logout_authenticate_scenario() {
    LoginResult result = manager.login(AccountNamespace.END_USER, "alice", PASSWORD);

    SessionIdentity identity = manager.authenticate(result.token());
    assertThat(identity.subjectId()).isEqualTo(1);
    assertThat(identity.role()).isEqualTo("user");
    assertThat(identity.namespace()).isEqualTo(AccountNamespace.END_USER);

    manager.logout(result.token());

    assertThatThrownBy(() -> manager.authenticate(result.token()))
        .isInstanceOf(AuthFailureException.class)
        .extracting(e -> ((AuthFailureException) e).failure())
        .isEqualTo(AuthFailure.UNAUTHORIZED);
    assertThat(ledger.contains(result.token())).isTrue();
  }

  @Test
  void login_byEmail() {
    LoginResult result = manager.login(AccountNamespace.END_USER, "alice@example.com", PASSWORD);

    assertThat(result.account().username()).isEqualTo("alice");
  }

  @Test
  void login_returnsViewAndRecordsLastLogin() {
    LoginResult result = manager.login(AccountNamespace.END_USER, "alice", PASSWORD);

    assertThat(result.account().email()).isEqualTo("alice@example.com");
    assertThat(accountStore.findById(AccountNamespace.END_USER, 1).orElseThrow().lastLoginAt()).isNotNull();
  }

  @Test
  void login_admin_carriesRoleAndNamespace() {
    LoginResult result = manager.login(AccountNamespace.ADMIN, "root", PASSWORD);

    SessionIdentity identity = manager.authenticate(result.token());
    assertThat(identity.namespace()).isEqualTo(AccountNamespace.ADMIN);
    assertThat(identity.role()).isEqualTo("superadmin");
  }

  @Test
  void login_wrongNamespace_isNotFound() {
    assertThatThrownBy(() -> manager.login(AccountNamespace.ADMIN, "alice", PASSWORD))
        .isInstanceOf(AuthFailureException.class)
        .extracting(e -> ((AuthFailureException) e).failure())
        .isEqualTo(AuthFailure.ACCOUNT_NOT_FOUND);
  }

  @Test
  void login_disabledAccount_rejectedEvenWithCorrectPassword() {
    assertThatThrownBy(() -> manager.login(AccountNamespace.END_USER, "mallory", PASSWORD))
        .isInstanceOf(AuthFailureException.class)
        .extracting(e -> ((AuthFailureException) e).failure())
        .isEqualTo(AuthFailure.ACCOUNT_DISABLED);
  }

  @Test
  void login_badPassword_repeatedlyRejected_thenCorrectSucceeds() {
    for (int i = 0; i < 3; i++) {
      assertThatThrownBy(() -> manager.login(AccountNamespace.END_USER, "alice", "wrong"))
          .isInstanceOf(AuthFailureException.class)
          .extracting(e -> ((AuthFailureException) e).failure())
          .isEqualTo(AuthFailure.BAD_CREDENTIALS);
    }

    assertThat(manager.login(AccountNamespace.END_USER, "alice", PASSWORD).token()).isNotBlank();
  }

  @Test
  void login_unknownAndWrongPassword_shareOutwardMessage() {
    AuthFailureException unknown = catchThrowableOfType(
        () -> manager.login(AccountNamespace.END_USER, "nobody", PASSWORD), AuthFailureException.class);
    AuthFailureException wrong = catchThrowableOfType(
        () -> manager.login(AccountNamespace.END_USER, "alice", "wrong"), AuthFailureException.class);

    assertThat(unknown.failure().publicMessage()).isEqualTo(wrong.failure().publicMessage());
  }

  @Test
  void login_missingFields_throwIllegalArgument() {
    assertThatThrownBy(() -> manager.login(AccountNamespace.END_USER, "", PASSWORD))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.login(AccountNamespace.END_USER, "alice", null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.login(null, "alice", PASSWORD))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void login_lastLoginFailure_stillSucceeds() {
    AccountStore failing = mock(AccountStore.class);
    when(failing.findByUsername(AccountNamespace.END_USER, "alice"))
        .thenReturn(accountStore.findByUsername(AccountNamespace.END_USER, "alice"));
    doThrow(new StoreUnavailableException("down", null)).when(failing).updateLastLogin(AccountNamespace.END_USER, 1);
    AuthenticationManager withFailingStore =
        new AuthenticationManager(failing, hasher, tokenManager, revocationCache);

    assertThat(withFailingStore.login(AccountNamespace.END_USER, "alice", PASSWORD).token()).isNotBlank();
  }

  @Test
  void login_storeUnavailable_propagates() {
    AccountStore failing = mock(AccountStore.class);
    when(failing.findByUsername(AccountNamespace.END_USER, "alice"))
        .thenThrow(new StoreUnavailableException("down", null));
    AuthenticationManager withFailingStore =
        new AuthenticationManager(failing, hasher, tokenManager, revocationCache);

    assertThatThrownBy(() -> withFailingStore.login(AccountNamespace.END_USER, "alice", PASSWORD))
        .isInstanceOf(StoreUnavailableException.class);
  }

  // ── logout / revoke ───────────────────────────────────────────────────────

  @Test
  void logout_malformedOrExpiredToken_isNoOp() {
    String expired = JWT.create()
        .withIssuer("test-issuer")
        .withSubject("1")
        .withExpiresAt(Instant.now().minusSeconds(60))
        .sign(Algorithm.HMAC256(SECRET));

    assertThatCode(() -> manager.logout("garbage")).doesNotThrowAnyException();
    assertThatCode(() -> manager.logout(expired)).doesNotThrowAnyException();
    assertThat(ledger.loadActive(Instant.now().minusSeconds(3600))).isEmpty();
  }

  @Test
  void logout_twice_isHarmless() {
    String token = manager.login(AccountNamespace.END_USER, "alice", PASSWORD).token();

    manager.logout(token);
    manager.logout(token);

    assertThatThrownBy(() -> manager.authenticate(token)).isInstanceOf(AuthFailureException.class);
  }

  @Test
  void logout_ledgerDown_tokenRemainsValid() {
    RevocationLedger failingLedger = mock(RevocationLedger.class);
    doThrow(new StoreUnavailableException("down", null))
        .when(failingLedger).record(anyString(), anyLong(), any(), anyString());
    RevocationCache failingCache = new RevocationCache(failingLedger, Clock.systemUTC(), false);
    AuthenticationManager withFailingLedger =
        new AuthenticationManager(accountStore, hasher, tokenManager, failingCache);
    String token = withFailingLedger.login(AccountNamespace.END_USER, "alice", PASSWORD).token();

    assertThatThrownBy(() -> withFailingLedger.logout(token)).isInstanceOf(StoreUnavailableException.class);
    assertThat(withFailingLedger.authenticate(token).username()).isEqualTo("alice");
  }

  @Test
  void revoke_adminInvalidation_recordsReason() {
    String token = manager.login(AccountNamespace.END_USER, "alice", PASSWORD).token();

    manager.revoke(token, RevocationReason.ADMIN_INVALIDATED);

    assertThatThrownBy(() -> manager.authenticate(token)).isInstanceOf(AuthFailureException.class);
  }

  @Test
  void logout_onOneInstance_seenByAnotherSharingTheLedger() {
    RevocationCache otherCache = new RevocationCache(ledger, Clock.systemUTC(), true);
    otherCache.initialize();
    AuthenticationManager otherInstance =
        new AuthenticationManager(accountStore, hasher, tokenManager, otherCache);
    String token = manager.login(AccountNamespace.END_USER, "alice", PASSWORD).token();

    manager.logout(token);

    assertThatThrownBy(() -> otherInstance.authenticate(token)).isInstanceOf(AuthFailureException.class);
  }

  @Test
  void logout_longestEmail_revokedInSqlLedger() {
    String email = "a".repeat(243) + "@example.com";
    accountStore.save(new Account(3, AccountNamespace.END_USER, "longmail", email, hasher.hash(PASSWORD),
        AccountStatus.ENABLED, "user", Instant.now(), null));
    Database database = Database.forUrlAndCredentials(
        "jdbc:h2:mem:manager-" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1", "sa", "");
    RevocationCache sqlCache = new RevocationCache(new JdbcRevocationLedger(database), Clock.systemUTC(), true);
    sqlCache.initialize();
    AuthenticationManager withSqlLedger = new AuthenticationManager(accountStore, hasher, tokenManager, sqlCache);
    String token = withSqlLedger.login(AccountNamespace.END_USER, email, PASSWORD).token();
    assertThat(token.length()).isGreaterThan(512);

    withSqlLedger.logout(token);

    assertThat(catchThrowableOfType(() -> withSqlLedger.authenticate(token), AuthFailureException.class).failure())
        .isEqualTo(AuthFailure.UNAUTHORIZED);
    RevocationCache restarted = new RevocationCache(new JdbcRevocationLedger(database), Clock.systemUTC(), false);
    restarted.initialize();
    assertThat(restarted.isRevoked(token)).isTrue();
  }

  @Test
  void sweep_purgesExpiredRevocation_tokenStillRejected() {
    String expired = tokenManager.issue(1, "alice", "alice@example.com", "user", AccountNamespace.END_USER,
        Duration.ofSeconds(-60));
    revocationCache.revoke(expired, 1, Instant.now().minusSeconds(60), RevocationReason.USER_LOGOUT.tag());
    String live = manager.login(AccountNamespace.END_USER, "alice", PASSWORD).token();
    manager.logout(live);

    assertThat(revocationCache.sweep()).isEqualTo(1);

    assertThat(ledger.contains(expired)).isFalse();
    assertThat(revocationCache.isRevoked(expired)).isFalse();
    assertThat(catchThrowableOfType(() -> manager.authenticate(expired), AuthFailureException.class).failure())
        .isEqualTo(AuthFailure.UNAUTHORIZED);
    assertThat(ledger.contains(live)).isTrue();
    assertThat(catchThrowableOfType(() -> manager.authenticate(live), AuthFailureException.class).failure())
        .isEqualTo(AuthFailure.UNAUTHORIZED);
  }

  // ── authenticate / roles / views ──────────────────────────────────────────

  @Test
  void authenticate_forgedToken_unauthorized() {
    String forged = new SessionTokenManager("another-secret-that-is-32-bytes-long".getBytes(),
        "test-issuer", Duration.ofHours(1))
        .issue(1, "alice", "alice@example.com", "superadmin", AccountNamespace.ADMIN, Duration.ofHours(1));

    assertThatThrownBy(() -> manager.authenticate(forged))
        .isInstanceOf(AuthFailureException.class)
        .extracting(e -> ((AuthFailureException) e).failure())
        .isEqualTo(AuthFailure.UNAUTHORIZED);
  }

  @Test
  void requireRole_checksMembership() {
    SessionIdentity identity = manager.authenticate(manager.login(AccountNamespace.ADMIN, "root", PASSWORD).token());

    assertThatCode(() -> manager.requireRole(identity, List.of("superadmin", "editor"))).doesNotThrowAnyException();
    assertThatCode(() -> manager.requireRole(identity, List.of())).doesNotThrowAnyException();
    assertThatThrownBy(() -> manager.requireRole(identity, List.of("user")))
        .isInstanceOf(AuthFailureException.class)
        .extracting(e -> ((AuthFailureException) e).failure())
        .isEqualTo(AuthFailure.FORBIDDEN);
  }

  @Test
  void getSafeAccountView_omitsHash() {
    Optional<AccountView> view = manager.getSafeAccountView(1, AccountNamespace.END_USER);

    assertThat(view).isPresent();
    assertThat(view.get().username()).isEqualTo("alice");
    assertThat(view.get().toString()).doesNotContain("$2");
    assertThat(manager.getSafeAccountView(42, AccountNamespace.END_USER)).isEmpty();
  }
}
