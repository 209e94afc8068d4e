package com.codeheadsystems.pds.server.resource;

import com.codeheadsystems.pds.model.server.CreateAccountRequest;
import com.codeheadsystems.pds.model.server.CreateAccountResponse;
import com.codeheadsystems.pds.model.server.GetSessionResponse;
import com.codeheadsystems.pds.server.manager.AccountRegistrationManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * XRPC endpoints of the {@code com.atproto.server} namespace.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /xrpc/com.atproto.server.createAccount}: register an account</li>
 *   <li>{@code GET /xrpc/com.atproto.server.getSession}: describe the bearer's account</li>
 * </ul>
 * Refused registrations are rendered by {@link XrpcExceptionMapper}.
 */
@Singleton
@Path("/xrpc")
@Produces(MediaType.APPLICATION_JSON)
public class ServerResource {

  private static final Logger log = LoggerFactory.getLogger(ServerResource.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final AccountRegistrationManager accountRegistrationManager;

  /**
   * Instantiates a new Server resource.
   *
   * @param accountRegistrationManager the account registration manager
   */
  @Inject
  public ServerResource(final AccountRegistrationManager accountRegistrationManager) {
    this.accountRegistrationManager = accountRegistrationManager;
    log.info("ServerResource({})", accountRegistrationManager);
  }

  /**
   * Creates an account.
   *
   * @param request the request
   * @return the new account's DID, handle and session tokens
   */
  @POST
  @Path("/com.atproto.server.createAccount")
  @Consumes(MediaType.APPLICATION_JSON)
  public CreateAccountResponse createAccount(final CreateAccountRequest request) {
    log.trace("createAccount(handle={})", request == null ? null : request.handle());
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    return accountRegistrationManager.register(request);
  }

  /**
   * Describes the account of the access token's bearer.
   *
   * @param authorization the {@code Authorization} header
   * @return the session
   */
  @GET
  @Path("/com.atproto.server.getSession")
  public GetSessionResponse getSession(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization) {
    log.trace("getSession()");
    if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
      throw new WebApplicationException("Authentication required", Response.Status.UNAUTHORIZED);
    }
    try {
      return accountRegistrationManager.getSession(authorization.substring(BEARER_PREFIX.length()).trim());
    } catch (SecurityException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.UNAUTHORIZED);
    }
  }
}
