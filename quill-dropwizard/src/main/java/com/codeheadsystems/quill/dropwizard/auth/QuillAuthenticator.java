package com.codeheadsystems.quill.dropwizard.auth;

import com.codeheadsystems.quill.server.auth.AuthFailureException;
import com.codeheadsystems.quill.server.manager.AuthenticationManager;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that checks bearer tokens with {@link AuthenticationManager}:
 * signature, expiry and revocation.
 */
public class QuillAuthenticator implements Authenticator<String, QuillPrincipal> {

  private final AuthenticationManager authenticationManager;

  public QuillAuthenticator(AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
  }

  @Override
  public Optional<QuillPrincipal> authenticate(String token) {
    try {
      return Optional.of(new QuillPrincipal(authenticationManager.authenticate(token)));
    } catch (AuthFailureException e) {
      return Optional.empty();
    }
  }
}
