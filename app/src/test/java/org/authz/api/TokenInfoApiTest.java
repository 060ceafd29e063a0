package org.authz.api;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.Map;
import org.authz.filter.RequestTokens;
import org.authz.token.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TokenInfoApiTest {
  private TokenInfoApi tokenInfoApi;
  private ContainerRequestContext mockRequest;

  @BeforeEach
  void setUp() {
    tokenInfoApi = new TokenInfoApi();
    mockRequest = mock(ContainerRequestContext.class);
  }

  @Test
  void execute_AuthorizedRequest_ReturnsTokenDescription() {
    Token token = Token.builder()
        .subject("user")
        .issuer("bar")
        .expiresAt(Instant.ofEpochSecond(4101104069L))
        .jwtId("id")
        .scope("foo:*")
        .build();
    when(mockRequest.getProperty(RequestTokens.TOKEN_PROPERTY)).thenReturn(token);

    Response response = tokenInfoApi.execute(mockRequest);

    assertThat(response.getStatus(), is(Response.Status.OK.getStatusCode()));
    Map<?, ?> body = (Map<?, ?>) response.getEntity();
    assertThat(body.get("sub"), is("user"));
    assertThat(body.get("iss"), is("bar"));
    assertThat(body.get("exp"), is(4101104069L));
    assertThat(body.get("scp"), is("foo:*"));
  }

  @Test
  void execute_NoToken_ReturnsServerError() {
    Response response = tokenInfoApi.execute(mockRequest);

    assertThat(response.getStatus(), is(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode()));
  }

  @Test
  void toBody_TokenWithoutExpiry_HasNullExpiry() {
    assertThat(TokenInfoApi.toBody(Token.builder().subject("user").build()).get("exp"),
        is(nullValue()));
  }
}
