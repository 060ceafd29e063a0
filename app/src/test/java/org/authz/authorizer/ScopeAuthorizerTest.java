package org.authz.authorizer;

import java.util.stream.Stream;
import org.authz.log.RequestLogger;
import org.authz.token.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.Logger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScopeAuthorizerTest {
  private static final AuthorizationContext CONTEXT =
      new AuthorizationContext("test", "GET", "foo/bar");

  private ScopeAuthorizer authorizer;

  @BeforeEach
  void setUp() {
    authorizer = new ScopeAuthorizer();
  }

  @ParameterizedTest
  @MethodSource("provideScopes")
  void authorize_Scope_ReturnsDecision(String scope, String resource, String method,
      AuthorizationDecision.Outcome expected) {
    AuthorizationDecision decision =
        authorizer.authorize(CONTEXT, token(scope), resource, method);

    assertThat(decision.getOutcome(), is(expected));
  }

  private static Stream<Arguments> provideScopes() {
    return Stream.of(
        Arguments.of("*", "foo:bar", "GET", AuthorizationDecision.Outcome.ALLOWED),
        Arguments.of("foo:bar", "foo:bar", "DELETE", AuthorizationDecision.Outcome.ALLOWED),
        Arguments.of("foo:bar:GET", "foo:bar", "GET", AuthorizationDecision.Outcome.ALLOWED),
        Arguments.of("foo:bar:get", "foo:bar", "GET", AuthorizationDecision.Outcome.ALLOWED),
        Arguments.of("foo:bar:GET", "foo:bar", "POST", AuthorizationDecision.Outcome.DENIED),
        Arguments.of("foo:*", "foo:bar", "GET", AuthorizationDecision.Outcome.ALLOWED),
        Arguments.of("foo:*", "foobar", "GET", AuthorizationDecision.Outcome.DENIED),
        Arguments.of("baz qux foo:*", "foo:bar:1", "PUT", AuthorizationDecision.Outcome.ALLOWED),
        Arguments.of("foo", "foo:bar", "GET", AuthorizationDecision.Outcome.DENIED),
        Arguments.of(null, "foo:bar", "GET", AuthorizationDecision.Outcome.DENIED),
        Arguments.of("  ", "foo:bar", "GET", AuthorizationDecision.Outcome.DENIED),
        Arguments.of("*", "", "GET", AuthorizationDecision.Outcome.FAILED),
        Arguments.of("*", "foo:bar", null, AuthorizationDecision.Outcome.FAILED)
    );
  }

  @Test
  void authorize_MissingResource_FailsWithCause() {
    AuthorizationDecision decision = authorizer.authorize(CONTEXT, token("*"), null, "GET");

    assertThat(decision.getOutcome(), is(AuthorizationDecision.Outcome.FAILED));
    assertThat(decision.getCause().get(), instanceOf(IllegalArgumentException.class));
  }

  @Test
  void withLog_ReturnsNewInstanceLoggingThroughRequestLogger() {
    Logger logger = mock(Logger.class);
    when(logger.isInfoEnabled()).thenReturn(true);

    Authorizer decorated = authorizer.withLog(RequestLogger.of(logger, "test"));
    decorated.authorize(CONTEXT, token("baz"), "foo:bar", "GET");

    assertThat(decorated, not(sameInstance(authorizer)));
    assertThat(decorated, instanceOf(ScopeAuthorizer.class));
    verify(logger).info(anyString(), any(Object[].class));
  }

  private static Token token(String scope) {
    return Token.builder().subject("user").scope(scope).build();
  }
}
