package org.authz.token;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A verified access token.
 *
 * <p>Instances are only produced by a {@link TokenVerifier} and are immutable, so the same instance
 * can be handed to downstream resources without re-verification.
 */
@Value
@Builder
public class Token {
  String subject;
  String issuer;
  Instant expiresAt;
  String jwtId;

  // Space separated list of granted scopes, null when the token carries none.
  String scope;

  @Builder.Default
  Map<String, Object> claims = Map.of();
}
