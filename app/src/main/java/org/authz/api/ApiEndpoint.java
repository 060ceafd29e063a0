package org.authz.api;

public class ApiEndpoint {
  public static final String TOKEN = "/token";

  private ApiEndpoint() {
  }
}
