package org.authz.filter;

import jakarta.ws.rs.core.Response;
import lombok.AllArgsConstructor;
import lombok.Getter;

// Every way the authorization filter can reject a request, with its fixed wire representation.
@Getter
@AllArgsConstructor
public enum AuthzFailure {
  CREDENTIAL_MISSING(Response.Status.UNAUTHORIZED, "missing or invalid auth header"),
  CREDENTIAL_INVALID(Response.Status.UNAUTHORIZED, "invalid jwt"),
  RESOLUTION_FAILED(Response.Status.INTERNAL_SERVER_ERROR, "internal error"),
  POLICY_DENIED(Response.Status.FORBIDDEN, "unauthorized"),
  AUTHORIZER_INTERNAL(Response.Status.INTERNAL_SERVER_ERROR, "internal error");

  private final Response.Status status;
  private final String message;

  public boolean isServerError() {
    return status.getFamily() == Response.Status.Family.SERVER_ERROR;
  }
}
