package org.authz.authorizer;

import java.util.Objects;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of an {@link Authorizer} call.
 *
 * <p>{@link Outcome#DENIED} means the policy refused the action. {@link Outcome#FAILED} means no
 * decision could be made; it carries the cause, which is for server-side logging only.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AuthorizationDecision {

  public enum Outcome {
    ALLOWED,
    DENIED,
    FAILED
  }

  private static final AuthorizationDecision ALLOWED =
      new AuthorizationDecision(Outcome.ALLOWED, null);
  private static final AuthorizationDecision DENIED =
      new AuthorizationDecision(Outcome.DENIED, null);

  private final Outcome outcome;
  @Getter(AccessLevel.NONE)
  private final Throwable cause;

  private AuthorizationDecision(Outcome outcome, Throwable cause) {
    this.outcome = outcome;
    this.cause = cause;
  }

  public static AuthorizationDecision allowed() {
    return ALLOWED;
  }

  public static AuthorizationDecision denied() {
    return DENIED;
  }

  public static AuthorizationDecision failed(Throwable cause) {
    return new AuthorizationDecision(Outcome.FAILED, Objects.requireNonNull(cause, "cause"));
  }

  public Optional<Throwable> getCause() {
    return Optional.ofNullable(cause);
  }

  public boolean isAllowed() {
    return outcome == Outcome.ALLOWED;
  }
}
