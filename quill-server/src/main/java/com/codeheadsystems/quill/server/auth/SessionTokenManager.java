package com.codeheadsystems.quill.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.quill.server.model.Account;
import com.codeheadsystems.quill.server.model.AccountNamespace;
import com.codeheadsystems.quill.server.model.SessionIdentity;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies self-contained session tokens (JWT, HMAC-SHA256).
 * <p>
 * The token carries the account id as subject plus username, email, role and namespace claims.
 * Verification is purely local: signature, issuer and expiry. Revocation is checked elsewhere.
 * The secret is fixed for the life of the instance; changing it invalidates every token issued
 * under the old one.
 */
public class SessionTokenManager {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

  static final String CLAIM_USERNAME = "username";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_NAMESPACE = "ns";

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Duration ttl;

  /**
   * Creates a new SessionTokenManager.
   *
   * @param secret HMAC-SHA256 signing secret
   * @param issuer JWT issuer claim
   * @param ttl    default token time-to-live
   */
  public SessionTokenManager(byte[] secret, String issuer, Duration ttl) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.issuer = issuer;
    this.ttl = ttl;
  }

  /**
   * Issues a token for an account using the default time-to-live.
   *
   * @param account the authenticated account
   * @return signed token string
   */
  public String issue(Account account) {
    return issue(account.id(), account.username(), account.email(), account.role(),
        account.namespace(), ttl);
  }

  /**
   * Issues a token expiring {@code ttl} from now.
   *
   * @param subjectId account id
   * @param username  login name
   * @param email     email address
   * @param role      role label
   * @param namespace account namespace
   * @param ttl       time-to-live
   * @return signed token string
   */
  public String issue(long subjectId, String username, String email, String role,
                      AccountNamespace namespace, Duration ttl) {
    Instant now = Instant.now();
    String jti = UUID.randomUUID().toString();
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(Long.toString(subjectId))
        .withClaim(CLAIM_USERNAME, username)
        .withClaim(CLAIM_EMAIL, email)
        .withClaim(CLAIM_ROLE, role)
        .withClaim(CLAIM_NAMESPACE, namespace.label())
        .withIssuedAt(now)
        .withExpiresAt(now.plus(ttl))
        .sign(algorithm);
    log.debug("Issued token jti={} for subject={} ({})", jti, subjectId, namespace.label());
    return token;
  }

  /**
   * Verifies signature, issuer and expiry and decodes the identity.
   *
   * @param token token string
   * @return the identity if the token is well-formed, correctly signed and unexpired; empty
   *     otherwise, without saying which check failed
   */
  public Optional<SessionIdentity> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      return Optional.of(new SessionIdentity(
          Long.parseLong(decoded.getSubject()),
          AccountNamespace.fromLabel(decoded.getClaim(CLAIM_NAMESPACE).asString()),
          decoded.getClaim(CLAIM_USERNAME).asString(),
          decoded.getClaim(CLAIM_EMAIL).asString(),
          decoded.getClaim(CLAIM_ROLE).asString(),
          decoded.getIssuedAtAsInstant(),
          decoded.getExpiresAtAsInstant()));
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      return Optional.empty();
    } catch (IllegalArgumentException e) {
      // NumberFormatException included: subject or namespace claim not in the expected shape
      log.debug("Token claims malformed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public Duration ttl() {
    return ttl;
  }
}
