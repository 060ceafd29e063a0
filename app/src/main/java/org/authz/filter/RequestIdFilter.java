package org.authz.filter;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.ext.Provider;
import java.util.UUID;
import org.slf4j.MDC;

/**
 * Assigns every request an id, taken from {@value #REQUEST_ID_HEADER} when the caller sends one.
 *
 * <p>The id is stored as request property {@value #REQUEST_ID_PROPERTY}, put into the logging MDC
 * while the request is processed, and echoed back in the response header.
 */
@Provider
@PreMatching
@Priority(Priorities.AUTHENTICATION - 500)
public class RequestIdFilter implements ContainerRequestFilter, ContainerResponseFilter {

  public static final String REQUEST_ID_HEADER = "X-Request-ID";
  public static final String REQUEST_ID_PROPERTY = "request_id";
  static final int MAX_REQUEST_ID_LENGTH = 128;

  @Override
  public void filter(ContainerRequestContext request) {
    String requestId = request.getHeaderString(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank() || requestId.length() > MAX_REQUEST_ID_LENGTH) {
      requestId = UUID.randomUUID().toString();
    }
    request.setProperty(REQUEST_ID_PROPERTY, requestId);
    MDC.put(REQUEST_ID_PROPERTY, requestId);
  }

  @Override
  public void filter(ContainerRequestContext request, ContainerResponseContext response) {
    String requestId = getRequestId(request);
    if (!requestId.isEmpty()) {
      response.getHeaders().putSingle(REQUEST_ID_HEADER, requestId);
    }
    MDC.remove(REQUEST_ID_PROPERTY);
  }

  // Empty when no id was assigned.
  public static String getRequestId(ContainerRequestContext request) {
    Object requestId = request.getProperty(REQUEST_ID_PROPERTY);
    return requestId instanceof String ? (String) requestId : "";
  }
}
