package org.authz;

import com.google.inject.Guice;
import com.google.inject.Injector;
import jakarta.inject.Inject;
import jakarta.ws.rs.ApplicationPath;
import org.glassfish.hk2.api.ServiceLocator;
import org.glassfish.jersey.server.ResourceConfig;
import org.jvnet.hk2.guice.bridge.api.GuiceBridge;
import org.jvnet.hk2.guice.bridge.api.GuiceIntoHK2Bridge;
import org.authz.guice.BaseModule;

@ApplicationPath("/")
public class AuthzApplication extends ResourceConfig {

  @Inject
  public AuthzApplication(ServiceLocator serviceLocator) {
    packages("org.authz");
    Injector injector = Guice.createInjector(new BaseModule());
    initGuiceIntoHK2Bridge(serviceLocator, injector);
  }

  // By default, Jersey framework uses HK2 for dependency injection.
  // To use Guice as our dependency injection framework, we provide guice injector to hk2-bridge.
  // So that hk2 can query guice injector for the verifier, resolver and authorizer the
  // authorization filter is built from.
  private void initGuiceIntoHK2Bridge(ServiceLocator serviceLocator, Injector injector) {
    GuiceBridge.getGuiceBridge().initializeGuiceBridge(serviceLocator);
    GuiceIntoHK2Bridge guiceBridge = serviceLocator.getService(GuiceIntoHK2Bridge.class);
    guiceBridge.bridgeGuiceInjector(injector);
  }
}
