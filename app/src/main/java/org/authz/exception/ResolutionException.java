package org.authz.exception;

// Thrown when a request cannot be mapped to a protected resource. Always a server-side problem.
public class ResolutionException extends AuthzException {

  public ResolutionException(String message) {
    super(message);
  }

  public ResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
