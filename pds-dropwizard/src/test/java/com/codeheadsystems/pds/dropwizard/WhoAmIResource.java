package com.codeheadsystems.pds.dropwizard;

import com.codeheadsystems.pds.dropwizard.auth.PdsPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Test-only protected endpoint that returns the authenticated account's DID.
 * Demonstrates how consumers can protect their own routes using {@code @Auth PdsPrincipal}.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  @GET
  public Map<String, String> whoAmI(@Auth PdsPrincipal principal) {
    return Map.of("did", principal.did());
  }
}
