package com.codeheadsystems.quire.dropwizard.auth;

import com.codeheadsystems.quire.model.ErrorResponse;
import com.codeheadsystems.quire.server.exception.UnauthorizedException;
import io.dropwizard.auth.UnauthorizedHandler;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Renders authentication failures with the same {@code {"error", "message"}} body as every
 * other error.
 */
public class JsonUnauthorizedHandler implements UnauthorizedHandler {

  @Override
  public Response buildResponse(String prefix, String realm) {
    return Response.status(Response.Status.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, prefix + " realm=\"" + realm + "\"")
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse("Unauthorized", UnauthorizedException.MESSAGE))
        .build();
  }
}
