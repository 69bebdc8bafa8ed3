package com.codeheadsystems.quire.dropwizard.filter;

import jakarta.annotation.Priority;
import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import java.util.Collection;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-origin policy for every route.
 * <p>
 * {@code Access-Control-Allow-Origin} echoes the request {@code Origin} only on an exact match
 * against the allow-list, together with {@code Access-Control-Allow-Credentials: true}; it is
 * never {@code *}. Preflight {@code OPTIONS} requests on any path are answered here with 204
 * and never reach a resource.
 */
@PreMatching
@Priority(Priorities.HEADER_DECORATOR)
public class CorsFilter implements ContainerRequestFilter, ContainerResponseFilter {

  private static final Logger log = LoggerFactory.getLogger(CorsFilter.class);

  static final String ORIGIN = "Origin";
  static final String VARY = "Vary";
  static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
  static final String ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";
  static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
  static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
  static final String ALLOWED_METHODS = "POST, GET, OPTIONS";
  static final String ALLOWED_HEADERS = "Content-Type, Authorization";

  private final Set<String> allowedOrigins;

  /**
   * Instantiates a new Cors filter.
   *
   * @param allowedOrigins exact origins, e.g. {@code https://app.example.com}
   */
  public CorsFilter(Collection<String> allowedOrigins) {
    this.allowedOrigins = Set.copyOf(allowedOrigins);
    log.info("CorsFilter(allowedOrigins={})", this.allowedOrigins);
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    if (HttpMethod.OPTIONS.equals(requestContext.getMethod())) {
      requestContext.abortWith(Response.noContent().build());
    }
  }

  @Override
  public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
    MultivaluedMap<String, Object> headers = responseContext.getHeaders();
    String origin = requestContext.getHeaderString(ORIGIN);
    if (isAllowed(origin)) {
      headers.putSingle(ALLOW_ORIGIN, origin);
      headers.putSingle(ALLOW_CREDENTIALS, "true");
    } else {
      headers.remove(ALLOW_ORIGIN);
      headers.remove(ALLOW_CREDENTIALS);
      if (origin != null) {
        log.debug("CORS rejected origin: {}", origin);
      }
    }
    headers.add(VARY, ORIGIN);
    headers.putSingle(ALLOW_METHODS, ALLOWED_METHODS);
    headers.putSingle(ALLOW_HEADERS, ALLOWED_HEADERS);
  }

  /**
   * Whether an origin is on the allow-list.
   *
   * @param origin the request origin
   * @return true on an exact match
   */
  public boolean isAllowed(String origin) {
    return origin != null && allowedOrigins.contains(origin);
  }
}
