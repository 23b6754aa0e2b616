package com.gentoro.autoreport.semantic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic view of one placeholder.
 *
 * @param intentConfidence in [0,1]
 * @param lowConfidence set when the confidence is under the configured floor; downstream weighting
 *     discounts the placeholder instead of failing it
 * @param metric the metric the placeholder asks for, taken from the recognized entities or the
 *     plain name
 */
public record SemanticAnalysis(
    Intent intent,
    double intentConfidence,
    boolean lowConfidence,
    List<InferredParameter> parameters,
    List<RecognizedEntity> entities,
    String metric) {

  public SemanticAnalysis {
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    entities = entities == null ? List.of() : List.copyOf(entities);
  }

  public Optional<InferredParameter> parameter(String key) {
    String canonical = ParameterKeys.canonical(key);
    return parameters.stream().filter(p -> p.key().equals(canonical)).findFirst();
  }

  public Optional<String> value(String key) {
    return parameter(key).map(InferredParameter::value);
  }

  /** Parameter values keyed by canonical key, in inference order. */
  public Map<String, String> parameterValues() {
    Map<String, String> out = new LinkedHashMap<>();
    parameters.forEach(p -> out.putIfAbsent(p.key(), p.value()));
    return out;
  }

  public List<RecognizedEntity> entities(EntityType type) {
    return entities.stream().filter(e -> e.type() == type).toList();
  }
}
