package org.authz.guice;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.security.GeneralSecurityException;
import java.util.Locale;
import org.authz.authorizer.Authorizer;
import org.authz.authorizer.NoopAuthorizer;
import org.authz.authorizer.ScopeAuthorizer;
import org.authz.resource.PathResourceResolver;
import org.authz.resource.ResourceResolver;
import org.authz.token.JwtTokenVerifier;
import org.authz.token.TokenVerifier;

public class BaseModule extends AbstractModule {

  private final ApplicationProperties properties;

  public BaseModule() {
    this(ApplicationProperties.load("application.properties"));
  }

  public BaseModule(ApplicationProperties properties) {
    this.properties = properties;
  }

  @Override
  protected void configure() {
    bind(ApplicationProperties.class).toInstance(properties);
  }

  @Provides
  @Singleton
  public TokenVerifier provideTokenVerifier() {
    try {
      return new JwtTokenVerifier(
          properties.getRequired(ApplicationProperties.JWT_PUBLIC_KEY),
          properties.get(ApplicationProperties.JWT_ISSUER, null),
          properties.getLong(ApplicationProperties.JWT_LEEWAY_SECONDS, 0));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new IllegalStateException("Unable to load the JWT public key", e);
    }
  }

  @Provides
  @Singleton
  public ResourceResolver provideResourceResolver() {
    return new PathResourceResolver(properties.get(ApplicationProperties.RESOURCE_PREFIX, ""));
  }

  @Provides
  @Singleton
  // Default to Noop Authorizer.
  public Authorizer provideAuthorizer() {
    String authorizer = properties.get(ApplicationProperties.AUTHORIZER, "noop");
    switch (authorizer.toLowerCase(Locale.ROOT)) {
      case "noop":
        return new NoopAuthorizer();
      case "scope":
        return new ScopeAuthorizer();
      default:
        throw new IllegalStateException("Unknown authorizer '" + authorizer
            + "', expected one of: noop, scope");
    }
  }
}
