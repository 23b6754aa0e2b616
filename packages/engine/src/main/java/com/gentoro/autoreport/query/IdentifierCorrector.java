package com.gentoro.autoreport.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces identifiers rejected by the data source with identifiers taken from the catalog.
 *
 * <p>Candidates never include the offending identifier or anything already rejected in the
 * session. When nothing in the catalog qualifies, no correction is offered; a guess is never made
 * up.
 */
public class IdentifierCorrector {

  /** An identifier found in a query together with its role there. */
  public record QueryIdentifier(String name, IdentifierKind kind) {}

  private static final String ID_START = "[\\p{L}_]";
  private static final String ID_PART = "[\\p{L}\\p{N}_]";
  private static final Pattern TABLE_REF =
      Pattern.compile("(?i)\\b(?:from|join)\\s+(" + ID_START + "[\\p{L}\\p{N}_.]*)");
  private static final Pattern TOKEN = Pattern.compile(ID_START + ID_PART + "*");
  private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

  private static final Set<String> KEYWORDS =
      Set.of(
          "select", "from", "where", "and", "or", "not", "as", "group", "by", "order", "asc",
          "desc", "limit", "offset", "having", "join", "left", "right", "inner", "outer", "on",
          "case", "when", "then", "else", "end", "null", "is", "in", "like", "between", "distinct",
          "sum", "avg", "count", "min", "max", "cast", "union", "all", "top", "true", "false");

  /** The first identifier in {@code query} that the catalog does not know, tables first. */
  public Optional<QueryIdentifier> findUnknown(String query, SchemaCatalog catalog) {
    for (String table : referencedTables(query)) {
      if (!catalog.hasTable(table)) {
        return Optional.of(new QueryIdentifier(table, IdentifierKind.TABLE));
      }
    }
    String stripped = STRING_LITERAL.matcher(query).replaceAll("''");
    Set<String> aliases = aliases(stripped);
    Matcher m = TOKEN.matcher(stripped);
    while (m.find()) {
      String token = m.group();
      String lower = token.toLowerCase(Locale.ROOT);
      if (KEYWORDS.contains(lower)
          || aliases.contains(lower)
          || isFunctionCall(stripped, m.end())) {
        continue;
      }
      if (m.start() > 0 && stripped.charAt(m.start() - 1) == '.') {
        continue;
      }
      if (!catalog.hasTable(token) && !catalog.hasColumn(token)) {
        return Optional.of(new QueryIdentifier(token, IdentifierKind.COLUMN));
      }
    }
    return Optional.empty();
  }

  /** Whether the identifier is used as a table in {@code query}. */
  public IdentifierKind classify(String identifier, String query) {
    String bare = SchemaCatalog.unqualified(identifier);
    for (String table : referencedTables(query)) {
      if (SchemaCatalog.unqualified(table).equalsIgnoreCase(bare)) {
        return IdentifierKind.TABLE;
      }
    }
    return IdentifierKind.COLUMN;
  }

  /**
   * Pick the catalog identifier that should replace {@code offending}.
   *
   * <p>Tables are ranked by how many of the query's known columns they declare, then by name
   * similarity. Columns are drawn from the tables the query references (all tables when none is
   * known) and ranked by name similarity and metric hints.
   */
  public Optional<String> replacementFor(
      String offending,
      IdentifierKind kind,
      String query,
      SchemaCatalog catalog,
      Set<String> rejected,
      QueryRequest request) {
    String bad = SchemaCatalog.unqualified(offending).toLowerCase(Locale.ROOT);
    Set<String> refused = lowerUnqualified(rejected);
    refused.add(bad);
    List<String> hints =
        request == null ? List.of() : TemplateQueryDraftGenerator.metricHints(request.metric());

    if (kind == IdentifierKind.TABLE) {
      List<String> knownColumns = knownColumns(query, catalog);
      return catalog.tables().stream()
          .filter(t -> !refused.contains(t.name().toLowerCase(Locale.ROOT)))
          .max(
              Comparator.comparingInt(
                      (TableSchema t) ->
                          (int) knownColumns.stream().filter(t::hasColumn).count())
                  .thenComparingDouble(t -> similarity(bad, t.name()) + hintScore(t.name(), hints)))
          .map(TableSchema::name);
    }

    List<TableSchema> scope = new ArrayList<>();
    for (String table : referencedTables(query)) {
      catalog.table(table).ifPresent(scope::add);
    }
    if (scope.isEmpty()) {
      scope.addAll(catalog.tables());
    }
    boolean aggregated =
        Pattern.compile("(?i)\\w+\\(\\s*" + Pattern.quote(offending) + "\\s*\\)")
            .matcher(query)
            .find();
    return scope.stream()
        .flatMap(t -> t.columns().stream())
        .filter(c -> !refused.contains(c.name().toLowerCase(Locale.ROOT)))
        .max(
            Comparator.comparingDouble(
                (ColumnSchema c) ->
                    similarity(bad, c.name())
                        + hintScore(c.name(), hints)
                        + (aggregated && c.isNumeric() ? 0.5 : 0.0)))
        .map(ColumnSchema::name);
  }

  /** Whether {@code query} uses {@code identifier} as a whole word, ignoring case. */
  public static boolean references(String query, String identifier) {
    return wordPattern(identifier).matcher(query).find()
        || wordPattern(SchemaCatalog.unqualified(identifier)).matcher(query).find();
  }

  /**
   * Replace whole-word occurrences of {@code offending} with {@code replacement}. Qualified names
   * reported by the data source fall back to their unqualified form.
   */
  public static String substitute(String query, String offending, String replacement) {
    String quoted = Matcher.quoteReplacement(replacement);
    String out = wordPattern(offending).matcher(query).replaceAll(quoted);
    if (out.equals(query)) {
      out = wordPattern(SchemaCatalog.unqualified(offending)).matcher(query).replaceAll(quoted);
    }
    return out;
  }

  static List<String> referencedTables(String query) {
    List<String> out = new ArrayList<>();
    Matcher m = TABLE_REF.matcher(query);
    while (m.find()) {
      out.add(m.group(1));
    }
    return out;
  }

  /** Normalized Levenshtein similarity in [0,1], ignoring case. */
  static double similarity(String a, String b) {
    String x = a.toLowerCase(Locale.ROOT);
    String y = b.toLowerCase(Locale.ROOT);
    int max = Math.max(x.length(), y.length());
    if (max == 0) {
      return 1.0;
    }
    int[] prev = new int[y.length() + 1];
    int[] cur = new int[y.length() + 1];
    for (int j = 0; j <= y.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= x.length(); i++) {
      cur[0] = i;
      for (int j = 1; j <= y.length(); j++) {
        int cost = x.charAt(i - 1) == y.charAt(j - 1) ? 0 : 1;
        cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = cur;
      cur = tmp;
    }
    return 1.0 - (double) prev[y.length()] / max;
  }

  private static double hintScore(String name, List<String> hints) {
    String lower = name.toLowerCase(Locale.ROOT);
    return hints.stream().anyMatch(lower::contains) ? 0.5 : 0.0;
  }

  private List<String> knownColumns(String query, SchemaCatalog catalog) {
    List<String> out = new ArrayList<>();
    Matcher m = TOKEN.matcher(STRING_LITERAL.matcher(query).replaceAll("''"));
    while (m.find()) {
      String token = m.group();
      if (!KEYWORDS.contains(token.toLowerCase(Locale.ROOT))
          && catalog.hasColumn(token)
          && !out.contains(token)) {
        out.add(token);
      }
    }
    return out;
  }

  private static Set<String> aliases(String query) {
    Set<String> out = new HashSet<>();
    Matcher m = Pattern.compile("(?i)\\bas\\s+(" + ID_START + ID_PART + "*)").matcher(query);
    while (m.find()) {
      out.add(m.group(1).toLowerCase(Locale.ROOT));
    }
    return out;
  }

  private static boolean isFunctionCall(String query, int end) {
    int i = end;
    while (i < query.length() && Character.isWhitespace(query.charAt(i))) {
      i++;
    }
    return i < query.length() && query.charAt(i) == '(';
  }

  private static Pattern wordPattern(String identifier) {
    return Pattern.compile(
        "(?<![\\p{L}\\p{N}_])" + Pattern.quote(identifier) + "(?![\\p{L}\\p{N}_])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  private static Set<String> lowerUnqualified(Set<String> identifiers) {
    Set<String> out = new HashSet<>();
    for (String id : identifiers) {
      out.add(SchemaCatalog.unqualified(id).toLowerCase(Locale.ROOT));
    }
    return out;
  }
}
