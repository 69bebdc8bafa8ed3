package com.codeheadsystems.quire.dropwizard.filter;

import com.codeheadsystems.quire.model.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects requests whose declared {@code Content-Length} exceeds the configured maximum with
 * 413, before any body is read.
 */
@PreMatching
@Priority(Priorities.AUTHENTICATION - 100)
public class RequestSizeLimitFilter implements ContainerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestSizeLimitFilter.class);

  static final String ERROR_CODE = "PayloadTooLarge";
  static final String MESSAGE = "Request body too large";

  private final long maxRequestBodyBytes;

  public RequestSizeLimitFilter(long maxRequestBodyBytes) {
    if (maxRequestBodyBytes < 1) {
      throw new IllegalArgumentException("maxRequestBodyBytes must be positive");
    }
    this.maxRequestBodyBytes = maxRequestBodyBytes;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    long length = declaredLength(requestContext.getHeaderString(HttpHeaders.CONTENT_LENGTH));
    if (length > maxRequestBodyBytes) {
      log.debug("Rejected {} byte request body (limit {})", length, maxRequestBodyBytes);
      requestContext.abortWith(Response.status(Response.Status.REQUEST_ENTITY_TOO_LARGE)
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(new ErrorResponse(ERROR_CODE, MESSAGE))
          .build());
    }
  }

  private static long declaredLength(String header) {
    if (header == null || header.isBlank()) {
      return -1;
    }
    try {
      return Long.parseLong(header.strip());
    } catch (NumberFormatException e) {
      // The connector rejects malformed lengths itself; treat as undeclared.
      return -1;
    }
  }
}
