package com.gentoro.autoreport.semantic;

/**
 * A parameter value available to query generation.
 *
 * @param rule short identifier of the rule that produced an inferred value; "markup" for explicit
 */
public record InferredParameter(String key, String value, Provenance provenance, String rule) {

  public static InferredParameter explicit(String key, String value) {
    return new InferredParameter(key, value, Provenance.EXPLICIT, "markup");
  }

  public static InferredParameter inferred(String key, String value, String rule) {
    return new InferredParameter(key, value, Provenance.INFERRED, rule);
  }

  public boolean isExplicit() {
    return provenance == Provenance.EXPLICIT;
  }
}
