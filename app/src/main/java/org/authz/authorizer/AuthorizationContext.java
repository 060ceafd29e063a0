package org.authz.authorizer;

import lombok.Value;

// Request details available to an Authorizer besides the token and the action.
@Value
public class AuthorizationContext {
  String requestId;
  String httpMethod;
  String path;
}
