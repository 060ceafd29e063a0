package org.authz.authorizer;

import org.authz.log.RequestLogger;
import org.authz.token.Token;

/**
 * Policy decision point consulted for every request after the token has been verified.
 *
 * <p>A single base instance is shared by all requests and must be safe for concurrent use.
 */
public interface Authorizer {

  /**
   * Decides whether the subject of {@code token} may apply {@code method} to {@code resource}.
   * Implementations report internal problems as {@link AuthorizationDecision#failed(Throwable)}
   * rather than throwing.
   */
  AuthorizationDecision authorize(AuthorizationContext context, Token token, String resource,
      String method);

  /**
   * Returns an authorizer that logs through {@code log}. Must return a new instance and leave
   * this one untouched.
   */
  Authorizer withLog(RequestLogger log);
}
