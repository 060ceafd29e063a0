package org.authz.exception;

// Base type for failures reported by the collaborators of the authorization filter.
public abstract class AuthzException extends Exception {

  protected AuthzException(String message) {
    super(message);
  }

  protected AuthzException(String message, Throwable cause) {
    super(message, cause);
  }
}
