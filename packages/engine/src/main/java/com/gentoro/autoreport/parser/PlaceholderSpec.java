package com.gentoro.autoreport.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gentoro.autoreport.utility.HashUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of parsing one placeholder token.
 *
 * <p>A composite spec owns its nested specs: either the spec standing in for the name ({@link
 * #nested()}) or specs given as parameter values. Specs that failed to parse are stubs with {@link
 * #hasError()} set; they still carry the raw text and offset so the document can report them.
 *
 * @param rawText token text exactly as found in the document, braces included
 * @param offset character offset of the token within the document (or within its parent token)
 * @param depth nesting depth, 1 for a top-level token
 * @param contentHash SHA-256 of the normalized markup, used as the dedup and cache key
 */
public record PlaceholderSpec(
    String rawText,
    int offset,
    int depth,
    SyntaxKind kind,
    PlaceholderType type,
    String typeLabel,
    String name,
    PlaceholderSpec nested,
    List<Parameter> parameters,
    String contentHash,
    List<ParseError> errors) {

  /** Parameter keys whose value is a boolean condition. */
  public static final Set<String> CONDITION_KEYS = Set.of("条件", "condition", "if", "when");

  public PlaceholderSpec {
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** Build a well-formed spec; the syntax kind and content hash are derived. */
  public static PlaceholderSpec of(
      String rawText,
      int offset,
      int depth,
      PlaceholderType type,
      String typeLabel,
      String name,
      PlaceholderSpec nested,
      List<Parameter> parameters) {
    SyntaxKind kind = classify(nested, parameters);
    PlaceholderSpec draft =
        new PlaceholderSpec(
            rawText, offset, depth, kind, type, typeLabel, name, nested, parameters, null, null);
    String hash = HashUtility.sha256Hex(PlaceholderSerializer.toMarkup(draft));
    return new PlaceholderSpec(
        rawText, offset, depth, kind, type, typeLabel, name, nested, parameters, hash, null);
  }

  /** Build a stub for a token that could not be parsed. */
  public static PlaceholderSpec error(
      String rawText, int offset, int depth, PlaceholderType type, List<ParseError> errors) {
    String normalized = rawText == null ? "" : rawText.trim();
    return new PlaceholderSpec(
        rawText,
        offset,
        depth,
        SyntaxKind.BASIC,
        type,
        null,
        null,
        null,
        List.of(),
        HashUtility.sha256Hex(normalized),
        errors);
  }

  static boolean isConditionKey(String key) {
    return key != null && CONDITION_KEYS.contains(key.trim().toLowerCase(Locale.ROOT));
  }

  private static SyntaxKind classify(PlaceholderSpec nested, List<Parameter> parameters) {
    List<Parameter> params = parameters == null ? List.of() : parameters;
    boolean hasNestedParam =
        params.stream().anyMatch(p -> p.value() instanceof ParameterValue.Nested);
    if (nested != null || hasNestedParam) {
      return SyntaxKind.COMPOSITE;
    }
    if (params.stream().anyMatch(p -> p.value() instanceof ParameterValue.Condition)) {
      return SyntaxKind.CONDITIONAL;
    }
    return params.isEmpty() ? SyntaxKind.BASIC : SyntaxKind.PARAMETERIZED;
  }

  public boolean hasError() {
    return !errors.isEmpty();
  }

  /** Parameters keyed by name. When a key repeats, the first occurrence wins. */
  @JsonIgnore
  public Map<String, ParameterValue> parameterMap() {
    Map<String, ParameterValue> map = new LinkedHashMap<>();
    for (Parameter p : parameters) {
      map.putIfAbsent(p.key(), p.value());
    }
    return Collections.unmodifiableMap(map);
  }

  /** Text value of a parameter, if present and not nested. */
  public Optional<String> textParameter(String key) {
    ParameterValue v = parameterMap().get(key);
    if (v instanceof ParameterValue.Text t) {
      return Optional.of(t.value());
    }
    return Optional.empty();
  }

  @JsonIgnore
  public Optional<ParameterValue.Condition> condition() {
    for (Parameter p : parameters) {
      if (p.value() instanceof ParameterValue.Condition c) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  /** Nested specs owned by this spec, name position first, then parameter values in order. */
  @JsonIgnore
  public List<PlaceholderSpec> children() {
    List<PlaceholderSpec> out = new ArrayList<>();
    if (nested != null) {
      out.add(nested);
    }
    for (Parameter p : parameters) {
      if (p.value() instanceof ParameterValue.Nested n) {
        out.add(n.spec());
      }
    }
    return out;
  }

  /** Human-readable name; composite specs use the innermost name. */
  @JsonIgnore
  public String displayName() {
    if (nested != null) {
      return nested.displayName();
    }
    return name == null ? "" : name;
  }

  PlaceholderSpec withErrors(List<ParseError> extra) {
    if (extra == null || extra.isEmpty()) {
      return this;
    }
    List<ParseError> all = new ArrayList<>(errors);
    all.addAll(extra);
    return new PlaceholderSpec(
        rawText, offset, depth, kind, type, typeLabel, name, nested, parameters, contentHash, all);
  }

  PlaceholderSpec withChildren(PlaceholderSpec newNested, List<Parameter> newParameters) {
    return new PlaceholderSpec(
        rawText,
        offset,
        depth,
        kind,
        type,
        typeLabel,
        name,
        newNested,
        newParameters,
        contentHash,
        errors);
  }
}
