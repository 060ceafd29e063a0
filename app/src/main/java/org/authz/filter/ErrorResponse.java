package org.authz.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

// JSON body of every rejected request.
@Value
public class ErrorResponse {
  @JsonProperty("error")
  String error;

  @JsonProperty("request_id")
  String requestId;
}
