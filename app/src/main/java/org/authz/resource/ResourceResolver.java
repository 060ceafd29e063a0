package org.authz.resource;

import jakarta.ws.rs.container.ContainerRequestContext;
import org.authz.exception.ResolutionException;

/**
 * Maps an incoming request to the {@link Action} it attempts.
 *
 * <p>Identifying the resource is the server's responsibility: a request that cannot be mapped is
 * reported as a {@link ResolutionException}, never as an authentication or authorization failure.
 * Implementations validate what they produce (e.g. no empty resource names).
 */
public interface ResourceResolver {
  Action resolve(ContainerRequestContext request) throws ResolutionException;
}
