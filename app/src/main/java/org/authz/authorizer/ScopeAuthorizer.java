package org.authz.authorizer;

import lombok.extern.slf4j.Slf4j;
import org.authz.log.RequestLogger;
import org.authz.token.Token;

/**
 * Grants an action when one of the token's scopes covers it.
 *
 * <p>A scope covers an action when it is {@code *}, equals the resource, equals
 * {@code resource:METHOD}, or is a {@code prefix:*} wildcard and the resource starts with
 * {@code prefix:}. Method matching is case-insensitive. Tokens without scope are denied.
 */
@Slf4j
public class ScopeAuthorizer implements Authorizer {
  private static final String WILDCARD = "*";
  private static final String SEPARATOR = ":";

  private final RequestLogger requestLog;

  public ScopeAuthorizer() {
    this(RequestLogger.of(log, ""));
  }

  private ScopeAuthorizer(RequestLogger requestLog) {
    this.requestLog = requestLog;
  }

  @Override
  public AuthorizationDecision authorize(AuthorizationContext context, Token token,
      String resource, String method) {
    if (token == null || resource == null || resource.isEmpty() || method == null) {
      return AuthorizationDecision.failed(new IllegalArgumentException(
          "token, resource and method are required, got resource=" + resource
              + " method=" + method));
    }

    String scope = token.getScope();
    if (scope == null || scope.isBlank()) {
      requestLog.debug("subject {} has no scope, denying {} {}", token.getSubject(), method,
          resource);
      return AuthorizationDecision.denied();
    }

    for (String granted : scope.trim().split("\\s+")) {
      if (covers(granted, resource, method)) {
        requestLog.debug("scope {} grants {} {} to subject {}", granted, method, resource,
            token.getSubject());
        return AuthorizationDecision.allowed();
      }
    }

    requestLog.info("subject {} is not allowed to {} {}", token.getSubject(), method, resource);
    return AuthorizationDecision.denied();
  }

  @Override
  public Authorizer withLog(RequestLogger log) {
    return new ScopeAuthorizer(log);
  }

  static boolean covers(String granted, String resource, String method) {
    if (granted.equals(WILDCARD) || granted.equals(resource)) {
      return true;
    }
    int methodStart = resource.length() + SEPARATOR.length();
    if (granted.length() == methodStart + method.length()
        && granted.startsWith(resource + SEPARATOR)
        && granted.substring(methodStart).equalsIgnoreCase(method)) {
      return true;
    }
    if (granted.endsWith(SEPARATOR + WILDCARD)) {
      String prefix = granted.substring(0, granted.length() - WILDCARD.length());
      return resource.startsWith(prefix);
    }
    return false;
  }
}
