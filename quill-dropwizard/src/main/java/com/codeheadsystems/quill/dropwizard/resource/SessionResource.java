package com.codeheadsystems.quill.dropwizard.resource;

import com.codeheadsystems.quill.dropwizard.api.LoginRequest;
import com.codeheadsystems.quill.dropwizard.api.LoginResponse;
import com.codeheadsystems.quill.dropwizard.auth.QuillPrincipal;
import com.codeheadsystems.quill.server.auth.AuthFailure;
import com.codeheadsystems.quill.server.auth.AuthFailureException;
import com.codeheadsystems.quill.server.manager.AuthenticationManager;
import com.codeheadsystems.quill.server.manager.LoginResult;
import com.codeheadsystems.quill.server.model.AccountNamespace;
import com.codeheadsystems.quill.server.model.AccountView;
import com.codeheadsystems.quill.server.model.SessionIdentity;
import com.codeheadsystems.quill.server.store.StoreUnavailableException;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for session handling.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/{namespace}/login}: verify credentials, return a bearer token</li>
 *   <li>{@code POST /auth/logout}: revoke the bearer token in the {@code Authorization} header</li>
 *   <li>{@code GET  /auth/me}: the authenticated account</li>
 * </ul>
 * Namespaces are {@code end-user} and {@code admin}.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SessionResource {

  private static final Logger log = LoggerFactory.getLogger(SessionResource.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final AuthenticationManager authenticationManager;

  public SessionResource(AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
  }

  @POST
  @Path("/{namespace}/login")
  public LoginResponse login(@PathParam("namespace") String namespace, LoginRequest request) {
    log.debug("login(namespace={})", namespace);
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    try {
      LoginResult result = authenticationManager.login(
          AccountNamespace.fromLabel(namespace), request.identifier(), request.password());
      return new LoginResponse(result.token(), result.account());
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (AuthFailureException e) {
      throw toWebException(e);
    } catch (StoreUnavailableException e) {
      throw unavailable(e);
    }
  }

  /**
   * Revokes the caller's token. A token that is already invalid or expired is accepted.
   */
  @POST
  @Path("/logout")
  @Consumes(MediaType.WILDCARD)
  public Response logout(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
      throw new WebApplicationException("Missing bearer token", Response.Status.BAD_REQUEST);
    }
    try {
      authenticationManager.logout(authorization.substring(BEARER_PREFIX.length()).trim());
      return Response.noContent().build();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (StoreUnavailableException e) {
      throw unavailable(e);
    }
  }

  @GET
  @Path("/me")
  public AccountView me(@Auth QuillPrincipal principal) {
    SessionIdentity identity = principal.identity();
    try {
      return authenticationManager.getSafeAccountView(identity.subjectId(), identity.namespace())
          .orElseThrow(() -> new WebApplicationException(Response.Status.NOT_FOUND));
    } catch (StoreUnavailableException e) {
      throw unavailable(e);
    }
  }

  private static WebApplicationException toWebException(AuthFailureException e) {
    Response.Status status = e.failure() == AuthFailure.FORBIDDEN
        ? Response.Status.FORBIDDEN
        : Response.Status.UNAUTHORIZED;
    return new WebApplicationException(e.failure().publicMessage(), status);
  }

  private static WebApplicationException unavailable(StoreUnavailableException e) {
    log.warn("Store unavailable: {}", e.getMessage());
    return new WebApplicationException("Service temporarily unavailable, retry later",
        Response.Status.SERVICE_UNAVAILABLE);
  }
}
