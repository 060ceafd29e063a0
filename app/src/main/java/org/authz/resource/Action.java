package org.authz.resource;

import lombok.Value;

// The operation a request attempts: a method applied to a named resource.
@Value
public class Action {
  String resource;
  String method;
}
