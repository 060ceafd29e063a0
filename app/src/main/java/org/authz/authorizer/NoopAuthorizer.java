package org.authz.authorizer;

import lombok.extern.slf4j.Slf4j;
import org.authz.log.RequestLogger;
import org.authz.token.Token;

// A no-operation authorizer, that lets any verified token through.
@Slf4j
public class NoopAuthorizer implements Authorizer {

  private final RequestLogger requestLog;

  public NoopAuthorizer() {
    this(RequestLogger.of(log, ""));
  }

  private NoopAuthorizer(RequestLogger requestLog) {
    this.requestLog = requestLog;
  }

  @Override
  public AuthorizationDecision authorize(AuthorizationContext context, Token token,
      String resource, String method) {
    requestLog.debug("allowing {} {} for subject {}", method, resource, token.getSubject());
    return AuthorizationDecision.allowed();
  }

  @Override
  public Authorizer withLog(RequestLogger log) {
    return new NoopAuthorizer(log);
  }
}
