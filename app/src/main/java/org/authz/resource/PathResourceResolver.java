package org.authz.resource;

import jakarta.ws.rs.container.ContainerRequestContext;
import java.util.Arrays;
import java.util.List;
import org.authz.exception.ResolutionException;

/**
 * Derives the resource name from the request path.
 *
 * <p>{@code GET /users/42/devices} resolves to resource {@code users:42:devices} and method
 * {@code GET}; with prefix {@code api} the resource becomes {@code api:users:42:devices}.
 */
public class PathResourceResolver implements ResourceResolver {
  private static final String SEPARATOR = ":";

  private final String prefix;

  public PathResourceResolver(String prefix) {
    this.prefix = prefix == null ? "" : prefix.trim();
  }

  public PathResourceResolver() {
    this("");
  }

  @Override
  public Action resolve(ContainerRequestContext request) throws ResolutionException {
    String path = request.getUriInfo().getPath();
    List<String> segments = Arrays.stream(path == null ? new String[0] : path.split("/"))
        .filter(segment -> !segment.isEmpty())
        .toList();

    if (segments.isEmpty()) {
      throw new ResolutionException("can't identify resource for path '" + path + "'");
    }

    String resource = String.join(SEPARATOR, segments);
    if (!prefix.isEmpty()) {
      resource = prefix + SEPARATOR + resource;
    }
    return new Action(resource, request.getMethod());
  }
}
