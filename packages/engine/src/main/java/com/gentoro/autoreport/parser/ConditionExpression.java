package com.gentoro.autoreport.parser;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Boolean condition attached to a conditional placeholder.
 *
 * <p>The grammar is deliberately small and has no way to call code:
 *
 * <ul>
 *   <li>Logical operators: {@code &&}, {@code ||} with standard precedence (AND binds tighter).
 *   <li>Parentheses for grouping.
 *   <li>Comparisons: {@code ==}, {@code !=}, {@code <}, {@code <=}, {@code >}, {@code >=}.
 *   <li>Literals: numbers, quoted strings (single or double quotes), {@code true}, {@code false},
 *       {@code null}.
 *   <li>Variables: bare identifiers (letters, CJK characters, digits, {@code _} and {@code .}).
 *   <li>Truthiness for a lone operand: empty string, zero, false and null are false.
 * </ul>
 *
 * <p>Examples:
 *
 * <pre>{@code
 * 销售额 > 1000
 * region == "华东" && month >= 6
 * (level == 'A' || level == 'B') && active
 * }</pre>
 */
public final class ConditionExpression {

  private final String source;
  private final Node root;
  private final Set<String> variables;

  private ConditionExpression(String source, Node root, Set<String> variables) {
    this.source = source;
    this.root = root;
    this.variables = Collections.unmodifiableSet(variables);
  }

  /**
   * Parse a condition.
   *
   * @throws IllegalArgumentException when the text is not a valid condition
   */
  public static ConditionExpression parse(String source) {
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("Condition is empty");
    }
    Parser p = new Parser(source);
    Node root = p.parseOr();
    p.skipWs();
    if (!p.atEnd()) {
      throw new IllegalArgumentException(
          "Unexpected '" + source.substring(p.i) + "' at position " + p.i);
    }
    return new ConditionExpression(source.trim(), root, p.variables);
  }

  public String source() {
    return source;
  }

  /** Variable names referenced by the condition, in order of first appearance. */
  public Set<String> variables() {
    return variables;
  }

  /** Evaluate against the given variables. Unbound variables evaluate to null. */
  public boolean evaluate(Map<String, ?> bindings) {
    return root.test(bindings == null ? Map.of() : bindings);
  }

  @Override
  public String toString() {
    return source;
  }

  // ---------------------------------------------------------------------------------------------
  // AST

  private sealed interface Node {
    boolean test(Map<String, ?> env);
  }

  private record Or(Node left, Node right) implements Node {
    @Override
    public boolean test(Map<String, ?> env) {
      return left.test(env) || right.test(env);
    }
  }

  private record And(Node left, Node right) implements Node {
    @Override
    public boolean test(Map<String, ?> env) {
      return left.test(env) && right.test(env);
    }
  }

  private record Compare(String op, Operand left, Operand right) implements Node {
    @Override
    public boolean test(Map<String, ?> env) {
      return compare(op, left.value(env), right.value(env));
    }
  }

  private record Truthy(Operand operand) implements Node {
    @Override
    public boolean test(Map<String, ?> env) {
      return truthy(operand.value(env));
    }
  }

  private sealed interface Operand {
    Object value(Map<String, ?> env);
  }

  private record Literal(Object literal) implements Operand {
    @Override
    public Object value(Map<String, ?> env) {
      return literal;
    }
  }

  private record Variable(String name) implements Operand {
    @Override
    public Object value(Map<String, ?> env) {
      return env.get(name);
    }
  }

  private record Group(Node node) implements Operand {
    @Override
    public Object value(Map<String, ?> env) {
      return node.test(env);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Evaluation helpers

  private static boolean compare(String op, Object a, Object b) {
    BigDecimal na = asNumber(a);
    BigDecimal nb = asNumber(b);
    if (na != null && nb != null) {
      int c = na.compareTo(nb);
      return switch (op) {
        case "==" -> c == 0;
        case "!=" -> c != 0;
        case "<" -> c < 0;
        case "<=" -> c <= 0;
        case ">" -> c > 0;
        case ">=" -> c >= 0;
        default -> false;
      };
    }
    if ("==".equals(op)) {
      return Objects.equals(normalize(a), normalize(b));
    }
    if ("!=".equals(op)) {
      return !Objects.equals(normalize(a), normalize(b));
    }
    if (a == null || b == null) {
      return false;
    }
    int c = String.valueOf(a).compareTo(String.valueOf(b));
    return switch (op) {
      case "<" -> c < 0;
      case "<=" -> c <= 0;
      case ">" -> c > 0;
      case ">=" -> c >= 0;
      default -> false;
    };
  }

  private static Object normalize(Object v) {
    if (v instanceof Boolean || v == null) {
      return v;
    }
    return String.valueOf(v);
  }

  private static BigDecimal asNumber(Object v) {
    if (v instanceof BigDecimal bd) {
      return bd;
    }
    if (v instanceof Number n) {
      return new BigDecimal(n.toString());
    }
    if (v instanceof String s) {
      try {
        return new BigDecimal(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static boolean truthy(Object v) {
    if (v == null) return false;
    if (v instanceof Boolean b) return b;
    if (v instanceof Number n) return new BigDecimal(n.toString()).signum() != 0;
    String s = String.valueOf(v);
    return !s.isEmpty() && !"false".equalsIgnoreCase(s) && !"0".equals(s);
  }

  // ---------------------------------------------------------------------------------------------
  // Recursive-descent parser

  private static final class Parser {
    private final String s;
    private final int n;
    private int i;
    private final Set<String> variables = new LinkedHashSet<>();

    Parser(String s) {
      this.s = s;
      this.n = s.length();
    }

    // or := and ('||' and)*
    Node parseOr() {
      Node left = parseAnd();
      skipWs();
      while (match("||")) {
        Node right = parseAnd();
        left = new Or(left, right);
        skipWs();
      }
      return left;
    }

    // and := cmp ('&&' cmp)*
    Node parseAnd() {
      Node left = parseComparison();
      skipWs();
      while (match("&&")) {
        Node right = parseComparison();
        left = new And(left, right);
        skipWs();
      }
      return left;
    }

    // cmp := operand (op operand)?
    Node parseComparison() {
      Operand a = parseOperand();
      skipWs();
      String op = readAny("==", "!=", "<=", ">=", "<", ">");
      if (op != null) {
        Operand b = parseOperand();
        return new Compare(op, a, b);
      }
      if (a instanceof Group g) {
        return g.node();
      }
      return new Truthy(a);
    }

    Operand parseOperand() {
      skipWs();
      if (atEnd()) {
        throw new IllegalArgumentException("Unexpected end of condition");
      }
      char c = s.charAt(i);
      if (c == '(') {
        i++;
        Node inner = parseOr();
        skipWs();
        if (!match(")")) {
          throw new IllegalArgumentException("Missing ')' at position " + i);
        }
        return new Group(inner);
      }
      if (c == '"' || c == '\'') {
        return new Literal(readString(c));
      }
      boolean signed = (c == '-' || c == '+') && i + 1 < n && Character.isDigit(s.charAt(i + 1));
      if (Character.isDigit(c) || signed) {
        return new Literal(readNumber());
      }
      if (isIdentStart(c)) {
        String ident = readIdentifier();
        return switch (ident) {
          case "true" -> new Literal(Boolean.TRUE);
          case "false" -> new Literal(Boolean.FALSE);
          case "null" -> new Literal(null);
          default -> {
            variables.add(ident);
            yield new Variable(ident);
          }
        };
      }
      throw new IllegalArgumentException("Unexpected character '" + c + "' at position " + i);
    }

    private String readString(char quote) {
      StringBuilder sb = new StringBuilder();
      i++; // opening quote
      while (i < n) {
        char c = s.charAt(i++);
        if (c == '\\' && i < n) {
          sb.append(s.charAt(i++));
        } else if (c == quote) {
          return sb.toString();
        } else {
          sb.append(c);
        }
      }
      throw new IllegalArgumentException("Unterminated string literal");
    }

    private BigDecimal readNumber() {
      int start = i;
      if (s.charAt(i) == '-' || s.charAt(i) == '+') i++;
      while (i < n && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) i++;
      try {
        return new BigDecimal(s.substring(start, i));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number '" + s.substring(start, i) + "'");
      }
    }

    private String readIdentifier() {
      int start = i;
      while (i < n && isIdentPart(s.charAt(i))) i++;
      return s.substring(start, i);
    }

    private static boolean isIdentStart(char c) {
      return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
      return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private String readAny(String... ops) {
      skipWs();
      for (String op : ops) {
        if (s.startsWith(op, i)) {
          i += op.length();
          return op;
        }
      }
      return null;
    }

    private boolean match(String token) {
      skipWs();
      if (s.startsWith(token, i)) {
        i += token.length();
        return true;
      }
      return false;
    }

    void skipWs() {
      while (i < n && Character.isWhitespace(s.charAt(i))) i++;
    }

    boolean atEnd() {
      return i >= n;
    }
  }
}
