package org.authz.filter;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.authz.authorizer.AuthorizationContext;
import org.authz.authorizer.AuthorizationDecision;
import org.authz.authorizer.Authorizer;
import org.authz.exception.InvalidTokenException;
import org.authz.exception.ResolutionException;
import org.authz.log.RequestLogger;
import org.authz.resource.Action;
import org.authz.resource.ResourceResolver;
import org.authz.token.Token;
import org.authz.token.TokenVerifier;

/**
 * Authorizes every request before it reaches a resource.
 *
 * <p>The request passes through, in order: bearer token extraction, token verification, resource
 * resolution and the authorization decision. The first failing stage aborts the request with the
 * {@link AuthzFailure} response for that stage. When all stages succeed the verified token is
 * stored under {@link RequestTokens#TOKEN_PROPERTY} and the request continues unchanged.
 *
 * <p>The filter keeps no per-request state; one instance serves all requests.
 */
@Provider
@PreMatching
@Priority(Priorities.AUTHENTICATION)
@Slf4j
public class AuthzFilter implements ContainerRequestFilter {

  private static final String BEARER_PREFIX = "Bearer ";

  private final TokenVerifier tokenVerifier;
  private final ResourceResolver resourceResolver;
  private final Authorizer authorizer;

  @Inject
  public AuthzFilter(TokenVerifier tokenVerifier, ResourceResolver resourceResolver,
      Authorizer authorizer) {
    this.tokenVerifier = tokenVerifier;
    this.resourceResolver = resourceResolver;
    this.authorizer = authorizer;
  }

  @Override
  public void filter(ContainerRequestContext request) {
    String requestId = RequestIdFilter.getRequestId(request);
    RequestLogger requestLog = RequestLogger.of(log, requestId);

    try {
      Token token = verify(extractToken(request));
      Action action = resolve(request);
      authorize(request, requestLog, token, action);

      request.setProperty(RequestTokens.TOKEN_PROPERTY, token);
    } catch (RejectedException e) {
      logRejection(requestLog, request, e);
      request.abortWith(toErrorResponse(e.getFailure(), requestId));
    }
  }

  private String extractToken(ContainerRequestContext request) throws RejectedException {
    String authorizationHeader = request.getHeaderString(HttpHeaders.AUTHORIZATION);
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      throw new RejectedException(AuthzFailure.CREDENTIAL_MISSING, null);
    }

    // Extract token by excluding BEARER_PREFIX.
    String token = authorizationHeader.substring(BEARER_PREFIX.length());
    if (token.isEmpty()) {
      throw new RejectedException(AuthzFailure.CREDENTIAL_MISSING, null);
    }
    return token;
  }

  private Token verify(String token) throws RejectedException {
    try {
      return tokenVerifier.verify(token);
    } catch (InvalidTokenException | RuntimeException e) {
      throw new RejectedException(AuthzFailure.CREDENTIAL_INVALID, e);
    }
  }

  private Action resolve(ContainerRequestContext request) throws RejectedException {
    try {
      return resourceResolver.resolve(request);
    } catch (ResolutionException | RuntimeException e) {
      throw new RejectedException(AuthzFailure.RESOLUTION_FAILED, e);
    }
  }

  private void authorize(ContainerRequestContext request, RequestLogger requestLog, Token token,
      Action action) throws RejectedException {
    AuthorizationContext context = new AuthorizationContext(requestLog.getRequestId(),
        request.getMethod(), request.getUriInfo().getPath());

    AuthorizationDecision decision;
    try {
      decision = authorizer.withLog(requestLog)
          .authorize(context, token, action.getResource(), action.getMethod());
    } catch (RuntimeException e) {
      throw new RejectedException(AuthzFailure.AUTHORIZER_INTERNAL, e);
    }
    if (decision == null) {
      throw new RejectedException(AuthzFailure.AUTHORIZER_INTERNAL,
          new IllegalStateException("authorizer returned no decision"));
    }

    switch (decision.getOutcome()) {
      case ALLOWED:
        return;
      case DENIED:
        throw new RejectedException(AuthzFailure.POLICY_DENIED, null);
      case FAILED:
      default:
        throw new RejectedException(AuthzFailure.AUTHORIZER_INTERNAL,
            decision.getCause().orElse(null));
    }
  }

  private void logRejection(RequestLogger requestLog, ContainerRequestContext request,
      RejectedException e) {
    AuthzFailure failure = e.getFailure();
    if (failure.isServerError()) {
      requestLog.error("rejecting {} /{} with {}", request.getMethod(),
          request.getUriInfo().getPath(), failure, e.getCause());
    } else if (e.getCause() != null) {
      requestLog.warn("rejecting {} /{} with {}: {}", request.getMethod(),
          request.getUriInfo().getPath(), failure, e.getCause().getMessage());
    } else {
      requestLog.info("rejecting {} /{} with {}", request.getMethod(),
          request.getUriInfo().getPath(), failure);
    }
  }

  static Response toErrorResponse(AuthzFailure failure, String requestId) {
    return Response.status(failure.getStatus())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(failure.getMessage(), requestId))
        .build();
  }

  // Carries the failing stage out of the pipeline. Never leaves this class.
  @Getter
  private static final class RejectedException extends Exception {
    private final AuthzFailure failure;

    RejectedException(AuthzFailure failure, Throwable cause) {
      super(failure.name(), cause, false, false);
      this.failure = failure;
    }
  }
}
