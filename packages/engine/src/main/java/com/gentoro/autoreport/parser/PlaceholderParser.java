package com.gentoro.autoreport.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Extracts placeholder tokens from template text.
 *
 * <p>Accepted forms:
 *
 * <pre>{@code
 * {{TYPE：NAME}}
 * {{TYPE：NAME|KEY=VALUE|KEY2=VALUE2}}
 * {{TYPE：{{TYPE2：NAME2|KEY=VALUE}}|KEY=VALUE}}
 * {{TYPE：NAME|条件=EXPR}}
 * }</pre>
 *
 * <p>Brace matching is iterative, so the nesting depth is known before any recursive descent
 * starts; tokens nested deeper than the configured maximum are rejected without being descended
 * into. A token that fails to parse becomes a stub spec carrying a {@link ParseError};
 * scanning then
 * continues with the rest of the document.
 */
public class PlaceholderParser {
  private static final org.slf4j.Logger log =
      com.gentoro.autoreport.logging.LoggingService.getLogger(PlaceholderParser.class);

  public static final int DEFAULT_MAX_NESTING_DEPTH = 5;

  private static final String OPEN = PlaceholderSerializer.OPEN;
  private static final String CLOSE = PlaceholderSerializer.CLOSE;
  private static final int EXCERPT = 40;

  private final int maxNestingDepth;
  private final SyntaxValidator validator = new SyntaxValidator();

  public PlaceholderParser() {
    this(DEFAULT_MAX_NESTING_DEPTH);
  }

  public PlaceholderParser(int maxNestingDepth) {
    if (maxNestingDepth < 1) {
      throw new IllegalArgumentException("maxNestingDepth must be >= 1");
    }
    this.maxNestingDepth = maxNestingDepth;
  }

  public int maxNestingDepth() {
    return maxNestingDepth;
  }

  /**
   * Parse every top-level placeholder in document order. Never throws for malformed markup.
   *
   * @param text raw template text, may be null
   */
  public List<PlaceholderSpec> parse(String text) {
    List<PlaceholderSpec> specs = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return specs;
    }

    int cursor = 0;
    while (cursor < text.length()) {
      int open = text.indexOf(OPEN, cursor);
      if (open < 0) {
        break;
      }
      Scan scan = scan(text, open);
      if (scan.end() < 0) {
        int stop = recoveryPoint(text, open);
        String raw = text.substring(open, stop);
        specs.add(
            PlaceholderSpec.error(
                raw,
                open,
                1,
                null,
                List.of(
                    new ParseError(
                        ParseErrorKind.UNTERMINATED_NESTING,
                        "No closing '}}' for placeholder starting with '"
                            + StringUtils.abbreviate(raw, EXCERPT)
                            + "'",
                        open))));
        // resume inside the broken token so that well-formed tokens after it are still found
        cursor = open + OPEN.length();
        continue;
      }

      String raw = text.substring(open, scan.end());
      PlaceholderSpec spec;
      if (scan.maxDepth() > maxNestingDepth) {
        spec =
            PlaceholderSpec.error(
                raw,
                open,
                1,
                null,
                List.of(
                    new ParseError(
                        ParseErrorKind.MAX_DEPTH_EXCEEDED,
                        "Nesting depth %d exceeds maximum of %d"
                            .formatted(scan.maxDepth(), maxNestingDepth),
                        open)));
      } else {
        spec = parseToken(raw, open, 1);
      }
      specs.add(validator.validate(spec));
      cursor = scan.end();
    }

    if (log.isDebugEnabled()) {
      long failed = specs.stream().filter(PlaceholderSpec::hasError).count();
      log.debug("Parsed {} placeholder(s), {} with errors", specs.size(), failed);
    }
    return specs;
  }

  /** Parse a single token such as {@code {{统计：销售额}}}. */
  public PlaceholderSpec parseOne(String token) {
    List<PlaceholderSpec> specs = parse(token);
    if (specs.isEmpty()) {
      return PlaceholderSpec.error(
          token,
          0,
          1,
          null,
          List.of(
              new ParseError(
                  ParseErrorKind.MALFORMED_DELIMITER, "Text contains no placeholder", 0)));
    }
    return specs.get(0);
  }

  // ---------------------------------------------------------------------------------------------

  private PlaceholderSpec parseToken(String raw, int offset, int depth) {
    String content = raw.substring(OPEN.length(), raw.length() - CLOSE.length());
    if (content.isBlank()) {
      return stub(
          raw, offset, depth, null, ParseErrorKind.MALFORMED_DELIMITER, "Empty placeholder");
    }

    List<String> segments = splitTopLevel(content, '|');
    String head = segments.get(0);
    int sep = indexOfSeparator(head);
    if (sep < 0) {
      return stub(
          raw,
          offset,
          depth,
          null,
          ParseErrorKind.MALFORMED_DELIMITER,
          "Missing '：' between type and name in '" + StringUtils.abbreviate(raw, EXCERPT) + "'");
    }

    String typeLabel = head.substring(0, sep).trim();
    if (typeLabel.contains(OPEN) || typeLabel.contains(CLOSE)) {
      return stub(
          raw, offset, depth, null, ParseErrorKind.MALFORMED_DELIMITER, "Braces inside type label");
    }
    Optional<PlaceholderType> type = PlaceholderType.fromLabel(typeLabel);
    if (type.isEmpty()) {
      return stub(
          raw,
          offset,
          depth,
          null,
          ParseErrorKind.UNKNOWN_TYPE,
          "Unknown placeholder type '" + typeLabel + "'");
    }

    String nameText = head.substring(sep + 1).trim();
    if (nameText.isEmpty()) {
      return stub(
          raw,
          offset,
          depth,
          type.get(),
          ParseErrorKind.EMPTY_NAME,
          "Placeholder name is empty");
    }

    PlaceholderSpec nested = null;
    if (nameText.startsWith(OPEN)) {
      Scan inner = scan(nameText, 0);
      if (inner.end() != nameText.length()) {
        return stub(
            raw,
            offset,
            depth,
            type.get(),
            ParseErrorKind.MALFORMED_DELIMITER,
            "Unexpected text around nested placeholder '"
                + StringUtils.abbreviate(nameText, EXCERPT)
                + "'");
      }
      nested = parseToken(nameText, offset + raw.indexOf(nameText, OPEN.length()), depth + 1);
    } else if (nameText.contains(OPEN) || nameText.contains(CLOSE)) {
      return stub(
          raw,
          offset,
          depth,
          type.get(),
          ParseErrorKind.MALFORMED_DELIMITER,
          "Stray braces in name '" + StringUtils.abbreviate(nameText, EXCERPT) + "'");
    }

    List<ParseError> errors = new ArrayList<>();
    List<Parameter> parameters = new ArrayList<>();
    for (int k = 1; k < segments.size(); k++) {
      String segment = segments.get(k);
      int eq = segment.indexOf('=');
      if (eq < 0) {
        errors.add(
            new ParseError(
                ParseErrorKind.MALFORMED_PARAMETER,
                "Parameter '" + segment.trim() + "' is missing '='",
                offset));
        continue;
      }
      String key = segment.substring(0, eq).trim();
      String value = segment.substring(eq + 1).trim();
      parameters.add(new Parameter(key, parseValue(key, value, raw, offset, depth, errors)));
    }

    PlaceholderSpec spec =
        PlaceholderSpec.of(raw, offset, depth, type.get(), typeLabel, nameText, nested, parameters);
    return spec.withErrors(errors);
  }

  private ParameterValue parseValue(
      String key, String value, String raw, int offset, int depth, List<ParseError> errors) {
    if (value.startsWith(OPEN)) {
      Scan inner = scan(value, 0);
      if (inner.end() == value.length()) {
        int at = offset + Math.max(0, raw.indexOf(value, OPEN.length()));
        return new ParameterValue.Nested(parseToken(value, at, depth + 1));
      }
      errors.add(
          new ParseError(
              ParseErrorKind.MALFORMED_DELIMITER,
              "Unexpected text around nested placeholder in parameter '" + key + "'",
              offset));
      return new ParameterValue.Text(value);
    }
    if (value.contains(OPEN) || value.contains(CLOSE)) {
      errors.add(
          new ParseError(
              ParseErrorKind.MALFORMED_DELIMITER,
              "Stray braces in parameter '" + key + "'",
              offset));
      return new ParameterValue.Text(value);
    }
    if (PlaceholderSpec.isConditionKey(key)) {
      try {
        return new ParameterValue.Condition(value, ConditionExpression.parse(value));
      } catch (IllegalArgumentException e) {
        errors.add(
            new ParseError(
                ParseErrorKind.INVALID_CONDITION,
                "Invalid condition '" + value + "': " + e.getMessage(),
                offset));
        return new ParameterValue.Condition(value, null);
      }
    }
    return new ParameterValue.Text(value);
  }

  private static PlaceholderSpec stub(
      String raw,
      int offset,
      int depth,
      PlaceholderType type,
      ParseErrorKind kind,
      String message) {
    return PlaceholderSpec.error(
        raw, offset, depth, type, List.of(new ParseError(kind, message, offset)));
  }

  // ---------------------------------------------------------------------------------------------
  // Lexical helpers

  /** Result of brace matching starting at an opening delimiter. */
  private record Scan(int end, int maxDepth) {}

  /**
   * Match braces iteratively from {@code open}. Returns the index just past the matching close, or
   * -1 if the token is unterminated.
   */
  private static Scan scan(String text, int open) {
    int depth = 0;
    int maxDepth = 0;
    int j = open;
    int n = text.length();
    while (j < n) {
      if (text.startsWith(OPEN, j)) {
        depth++;
        maxDepth = Math.max(maxDepth, depth);
        j += OPEN.length();
      } else if (text.startsWith(CLOSE, j)) {
        depth--;
        j += CLOSE.length();
        if (depth == 0) {
          return new Scan(j, maxDepth);
        }
      } else {
        j++;
      }
    }
    return new Scan(-1, maxDepth);
  }

  /** End of the stub for an unterminated token: the next opening delimiter or the line end. */
  private static int recoveryPoint(String text, int open) {
    int nextOpen = text.indexOf(OPEN, open + OPEN.length());
    int lineEnd = text.indexOf('\n', open);
    int stop = text.length();
    if (nextOpen >= 0) stop = Math.min(stop, nextOpen);
    if (lineEnd >= 0) stop = Math.min(stop, lineEnd);
    return stop;
  }

  /**
   * Split on {@code delimiter} occurrences that are not inside a nested token. Within a parameter
   * value a doubled delimiter ({@code ||}) and quoted string literals are kept intact.
   */
  static List<String> splitTopLevel(String content, char delimiter) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    int j = 0;
    boolean inValue = false;
    char quote = 0;
    while (j < content.length()) {
      char c = content.charAt(j);
      if (quote != 0) {
        if (c == '\\') {
          j++;
        } else if (c == quote) {
          quote = 0;
        }
        j++;
      } else if (content.startsWith(OPEN, j)) {
        depth++;
        j += OPEN.length();
      } else if (content.startsWith(CLOSE, j)) {
        depth = Math.max(0, depth - 1);
        j += CLOSE.length();
      } else if (depth > 0) {
        j++;
      } else if (inValue && (c == '"' || c == '\'')) {
        quote = c;
        j++;
      } else if (c == delimiter) {
        if (inValue && j + 1 < content.length() && content.charAt(j + 1) == delimiter) {
          j += 2;
          continue;
        }
        parts.add(content.substring(start, j));
        start = j + 1;
        inValue = false;
        j++;
      } else {
        if (c == '=' && start > 0) {
          inValue = true;
        }
        j++;
      }
    }
    parts.add(content.substring(start));
    return parts;
  }

  /** Index of the first top-level full-width or ASCII colon. */
  private static int indexOfSeparator(String head) {
    int depth = 0;
    int j = 0;
    while (j < head.length()) {
      if (head.startsWith(OPEN, j)) {
        depth++;
        j += OPEN.length();
      } else if (head.startsWith(CLOSE, j)) {
        depth = Math.max(0, depth - 1);
        j += CLOSE.length();
      } else {
        char c = head.charAt(j);
        if (depth == 0 && (c == PlaceholderSerializer.SEPARATOR || c == ':')) {
          return j;
        }
        j++;
      }
    }
    return -1;
  }
}
