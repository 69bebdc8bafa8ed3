package com.codeheadsystems.quire.server.resource;

import com.codeheadsystems.quire.model.ErrorResponse;
import com.codeheadsystems.quire.server.exception.DuplicateIdentityException;
import com.codeheadsystems.quire.server.exception.QuireException;
import com.codeheadsystems.quire.server.exception.UnavailableException;
import com.codeheadsystems.quire.server.exception.ValidationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates {@link QuireException}s into {@code {"error", "message"}} JSON responses.
 * <p>
 * Only the exception's code and client-safe message reach the body.
 */
@Provider
public class QuireExceptionMapper implements ExceptionMapper<QuireException> {

  private static final Logger log = LoggerFactory.getLogger(QuireExceptionMapper.class);

  static final String RETRY_AFTER_SECONDS = "1";

  @Override
  public Response toResponse(QuireException exception) {
    Response.Status status = statusFor(exception);
    log.debug("{} -> {}", exception.getClass().getSimpleName(), status.getStatusCode());
    Response.ResponseBuilder builder = Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(exception.errorCode(), exception.getMessage()));
    if (exception instanceof UnavailableException) {
      builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
    }
    return builder.build();
  }

  static Response.Status statusFor(QuireException exception) {
    if (exception instanceof ValidationException) {
      return Response.Status.BAD_REQUEST;
    }
    if (exception instanceof DuplicateIdentityException) {
      return Response.Status.CONFLICT;
    }
    if (exception instanceof UnavailableException) {
      return Response.Status.SERVICE_UNAVAILABLE;
    }
    return Response.Status.UNAUTHORIZED;
  }
}
