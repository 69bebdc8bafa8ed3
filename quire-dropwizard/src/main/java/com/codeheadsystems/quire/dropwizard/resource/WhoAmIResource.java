package com.codeheadsystems.quire.dropwizard.resource;

import com.codeheadsystems.quire.dropwizard.auth.QuirePrincipal;
import com.codeheadsystems.quire.model.WhoAmIResponse;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Session-protected endpoint that returns the authenticated account.
 * The front-end calls it on page load to decide whether the user is signed in.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  /**
   * Returns the identity and display name of the session's account.
   *
   * @param principal the principal injected by the Dropwizard auth filter
   * @return identity and display name
   */
  @GET
  public WhoAmIResponse whoAmI(@Auth QuirePrincipal principal) {
    return new WhoAmIResponse(principal.identity(), principal.displayName());
  }
}
