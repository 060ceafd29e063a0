package org.authz.resource;

import jakarta.ws.rs.container.ContainerRequestContext;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.authz.exception.ResolutionException;

/**
 * Selects a {@link ResourceResolver} per route.
 *
 * <p>The route with the longest path prefix matching the request wins. Prefixes match on whole
 * segments, so {@code /users} covers {@code /users} and {@code /users/42} but not
 * {@code /usersettings}. Requests no route covers go to the fallback, or fail when there is none.
 */
public class RoutingResourceResolver implements ResourceResolver {

  private final List<Map.Entry<String, ResourceResolver>> routes;
  private final ResourceResolver fallback;

  private RoutingResourceResolver(Map<String, ResourceResolver> routes,
      ResourceResolver fallback) {
    this.routes = routes.entrySet().stream()
        .map(route -> Map.entry(route.getKey(), route.getValue()))
        .sorted(Comparator.comparingInt(
            (Map.Entry<String, ResourceResolver> route) -> route.getKey().length()).reversed())
        .toList();
    this.fallback = fallback;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Action resolve(ContainerRequestContext request) throws ResolutionException {
    String path = normalize(request.getUriInfo().getPath());
    for (Map.Entry<String, ResourceResolver> route : routes) {
      if (covers(route.getKey(), path)) {
        return route.getValue().resolve(request);
      }
    }
    if (fallback == null) {
      throw new ResolutionException("no resource route for path '" + path + "'");
    }
    return fallback.resolve(request);
  }

  private static boolean covers(String prefix, String path) {
    if (prefix.equals("/")) {
      return true;
    }
    return path.equals(prefix) || path.startsWith(prefix + "/");
  }

  static String normalize(String path) {
    String normalized = path == null ? "" : path.trim();
    if (!normalized.startsWith("/")) {
      normalized = "/" + normalized;
    }
    while (normalized.length() > 1 && normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  public static class Builder {
    private final Map<String, ResourceResolver> routes = new LinkedHashMap<>();
    private ResourceResolver fallback;

    public Builder route(String pathPrefix, ResourceResolver resolver) {
      if (resolver == null) {
        throw new IllegalArgumentException("resolver must not be null");
      }
      routes.put(normalize(pathPrefix), resolver);
      return this;
    }

    public Builder fallback(ResourceResolver resolver) {
      this.fallback = resolver;
      return this;
    }

    public RoutingResourceResolver build() {
      return new RoutingResourceResolver(routes, fallback);
    }
  }
}
