package org.authz.token;

import org.authz.exception.InvalidTokenException;

// Verifies a raw bearer token. Implementations must be safe for concurrent use.
public interface TokenVerifier {
  Token verify(String token) throws InvalidTokenException;
}
