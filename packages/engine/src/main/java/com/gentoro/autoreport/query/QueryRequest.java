package com.gentoro.autoreport.query;

import com.gentoro.autoreport.semantic.Intent;
import java.util.Map;

/**
 * What a placeholder asks for, in the terms the draft generator understands.
 *
 * @param parameters canonical parameter keys to values, explicit and inferred alike
 */
public record QueryRequest(
    String placeholderName, Intent intent, String metric, Map<String, String> parameters) {

  public QueryRequest {
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }

  public String parameter(String key) {
    return parameters.get(key);
  }

  public ResultShape expectedShape() {
    return ResultShape.forIntent(intent);
  }
}
