package com.codeheadsystems.quill.dropwizard.auth;

import com.codeheadsystems.quill.server.model.SessionIdentity;
import java.security.Principal;

/**
 * Principal representing an authenticated Quill account.
 *
 * @param identity identity decoded from the bearer token
 */
public record QuillPrincipal(SessionIdentity identity) implements Principal {

  @Override
  public String getName() {
    return identity.username();
  }
}
