package com.codeheadsystems.quill.dropwizard.auth;

import com.codeheadsystems.quill.server.auth.AuthFailureException;
import com.codeheadsystems.quill.server.manager.AuthenticationManager;
import io.dropwizard.auth.Authorizer;
import jakarta.ws.rs.container.ContainerRequestContext;
import java.util.List;

/**
 * Backs {@code @RolesAllowed} with {@link AuthenticationManager#requireRole}.
 */
public class QuillAuthorizer implements Authorizer<QuillPrincipal> {

  private final AuthenticationManager authenticationManager;

  public QuillAuthorizer(AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
  }

  @Override
  public boolean authorize(QuillPrincipal principal, String role, ContainerRequestContext requestContext) {
    try {
      authenticationManager.requireRole(principal.identity(), List.of(role));
      return true;
    } catch (AuthFailureException e) {
      return false;
    }
  }
}
