package org.authz.filter;

import jakarta.ws.rs.container.ContainerRequestContext;
import java.util.Map;
import java.util.Optional;
import org.authz.token.Token;

/**
 * Read access to the token {@link AuthzFilter} publishes for an authorized request.
 *
 * <p>This is a plain lookup and performs no verification. An empty result means no token was
 * stored, which only happens when the request was not authorized.
 */
public final class RequestTokens {

  public static final String TOKEN_PROPERTY = "authz_token";

  private RequestTokens() {
  }

  public static Optional<Token> getRequestToken(ContainerRequestContext request) {
    return asToken(request.getProperty(TOKEN_PROPERTY));
  }

  public static Optional<Token> getRequestToken(Map<String, ?> env) {
    return asToken(env.get(TOKEN_PROPERTY));
  }

  private static Optional<Token> asToken(Object value) {
    if (value instanceof Token) {
      return Optional.of((Token) value);
    }
    return Optional.empty();
  }
}
