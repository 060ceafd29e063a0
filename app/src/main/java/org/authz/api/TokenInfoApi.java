package org.authz.api;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.authz.filter.RequestTokens;
import org.authz.token.Token;

// Describes the verified token the request was authorized with.
@Path(ApiEndpoint.TOKEN)
@Slf4j
public class TokenInfoApi {

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public Response execute(@Context ContainerRequestContext request) {
    Optional<Token> token = RequestTokens.getRequestToken(request);
    if (token.isEmpty()) {
      log.error("No verified token on an authorized request to {}", ApiEndpoint.TOKEN);
      return Response.serverError().build();
    }
    return Response.ok(toBody(token.get())).build();
  }

  static Map<String, Object> toBody(Token token) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("sub", token.getSubject());
    body.put("iss", token.getIssuer());
    body.put("exp", token.getExpiresAt() == null ? null : token.getExpiresAt().getEpochSecond());
    body.put("jti", token.getJwtId());
    body.put("scp", token.getScope());
    return body;
  }
}
