package org.authz.guice;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

// Settings from `application.properties`, where an environment variable with the same name as a
// key takes precedence over the file.
public class ApplicationProperties {

  public static final String JWT_PUBLIC_KEY = "authz.jwt.publicKey";
  public static final String JWT_ISSUER = "authz.jwt.issuer";
  public static final String JWT_LEEWAY_SECONDS = "authz.jwt.leewaySeconds";
  public static final String RESOURCE_PREFIX = "authz.resource.prefix";
  public static final String AUTHORIZER = "authz.authorizer";

  private final Properties properties;
  private final Map<String, String> environment;

  ApplicationProperties(Properties properties, Map<String, String> environment) {
    this.properties = properties;
    this.environment = environment;
  }

  public static ApplicationProperties load(String resourceName) {
    try (InputStream input = ApplicationProperties.class.getClassLoader()
        .getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new IllegalStateException("Unable to find " + resourceName + " in resources");
      }
      Properties properties = new Properties();
      properties.load(input);
      return new ApplicationProperties(properties, System.getenv());
    } catch (IOException e) {
      throw new IllegalStateException("Unable to read " + resourceName + " from resources", e);
    }
  }

  // Retrieves the value of a specified property, first checking environment variables,
  // then falling back to the configuration file if the environment variable is not set.
  public String get(String key, String defaultValue) {
    String propertyValue = environment.get(key);
    if (propertyValue == null || propertyValue.isBlank()) {
      propertyValue = properties.getProperty(key);
    }
    if (propertyValue == null || propertyValue.isBlank()) {
      return defaultValue;
    }
    return propertyValue.trim();
  }

  public String getRequired(String key) {
    String value = get(key, null);
    if (value == null) {
      throw new IllegalStateException("Missing required configuration property " + key);
    }
    return value;
  }

  public long getLong(String key, long defaultValue) {
    String value = get(key, null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Configuration property " + key + " is not a number: "
          + value, e);
    }
  }
}
