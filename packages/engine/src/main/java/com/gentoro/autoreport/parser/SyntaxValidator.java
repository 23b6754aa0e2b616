package com.gentoro.autoreport.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cross-field checks that run after parsing: repeated or empty parameter keys, empty values,
 * conditions that reference no variable, and nested specs that carry errors. Nested specs are
 * validated before their parent.
 */
public final class SyntaxValidator {

  public PlaceholderSpec validate(PlaceholderSpec spec) {
    if (spec == null || spec.name() == null) {
      // stubs produced by the parser already carry their error
      return spec;
    }

    PlaceholderSpec nested = spec.nested() == null ? null : validate(spec.nested());
    List<Parameter> parameters = new ArrayList<>(spec.parameters().size());
    for (Parameter p : spec.parameters()) {
      if (p.value() instanceof ParameterValue.Nested n) {
        parameters.add(new Parameter(p.key(), new ParameterValue.Nested(validate(n.spec()))));
      } else {
        parameters.add(p);
      }
    }
    PlaceholderSpec current = spec.withChildren(nested, parameters);

    List<ParseError> errors = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    Set<String> reportedDuplicates = new HashSet<>();
    for (Parameter p : parameters) {
      String key = p.key();
      if (key == null || key.isBlank()) {
        errors.add(error(spec, ParseErrorKind.EMPTY_PARAMETER, "Parameter key is empty"));
        continue;
      }
      if (!seen.add(key) && reportedDuplicates.add(key)) {
        errors.add(
            error(spec, ParseErrorKind.DUPLICATE_PARAMETER, "Parameter '" + key + "' is repeated"));
      }
      if (p.value() instanceof ParameterValue.Text t && t.value().isBlank()) {
        errors.add(
            error(spec, ParseErrorKind.EMPTY_PARAMETER, "Parameter '" + key + "' has no value"));
      }
      if (p.value() instanceof ParameterValue.Condition c
          && c.isValid()
          && c.expression().variables().isEmpty()) {
        errors.add(
            error(
                spec,
                ParseErrorKind.INVALID_CONDITION,
                "Condition '" + c.source() + "' references no variable"));
      }
    }

    for (PlaceholderSpec child : current.children()) {
      if (child.hasError()) {
        errors.add(
            error(
                spec,
                ParseErrorKind.NESTED_ERROR,
                "Nested placeholder is invalid: " + child.errors().get(0).message()));
      }
    }

    errors.removeIf(
        e ->
            spec.errors().stream()
                .anyMatch(x -> x.kind() == e.kind() && x.message().equals(e.message())));
    return current.withErrors(errors);
  }

  private static ParseError error(PlaceholderSpec spec, ParseErrorKind kind, String message) {
    return new ParseError(kind, message, spec.offset());
  }
}
