package com.gentoro.autoreport.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.autoreport.context.DocumentContext;
import com.gentoro.autoreport.context.Paragraph;
import com.gentoro.autoreport.context.Section;
import com.gentoro.autoreport.exception.TemplateException;
import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Reads markdown templates from a directory. Optional YAML front matter supplies document
 * metadata:
 *
 * <pre>
 * ---
 * title: 月度销售报告
 * document_type: monthly_report
 * domain: sales
 * language: zh
 * reference_date: 2024-02-01
 * variables:
 *   region: 华东
 * ---
 * </pre>
 *
 * <p>Sections start at ATX headings ({@code #} to {@code ######}); text before the first heading
 * forms a level 0 section. Paragraphs are runs of non-blank lines. All offsets refer to the body
 * with the front matter removed, which is also the text returned for parsing.
 */
public class MarkdownTemplateContentSource implements TemplateContentSource {
  private static final Logger log = LoggingService.getLogger(MarkdownTemplateContentSource.class);

  private static final Pattern FRONT_MATTER =
      Pattern.compile("\\A---\\s*\\R(.*?)\\R---\\s*(\\R|\\z)", Pattern.DOTALL);
  private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*?)\\s*#*\\s*$");

  private final Path directory;

  public MarkdownTemplateContentSource(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /** Resolve {@code templateId} against the directory; a missing extension defaults to .md. */
  @Override
  public TemplateDocument load(String templateId) {
    if (StringUtils.isBlank(templateId)) {
      throw new TemplateException("Template id must not be blank", null);
    }
    Path file = directory.resolve(templateId.endsWith(".md") ? templateId : templateId + ".md");
    return read(file);
  }

  /** Read a markdown file from an arbitrary location. */
  public static TemplateDocument read(Path file) {
    try {
      String raw = Files.readString(file, StandardCharsets.UTF_8);
      TemplateDocument doc = parse(raw, file.toString());
      log.debug(
          "Loaded template {} with {} section(s)", file, doc.context().sections().size());
      return doc;
    } catch (IOException e) {
      throw new TemplateException("Failed to read template: " + file, e);
    }
  }

  public static TemplateDocument parse(String markdown) {
    return parse(markdown, "inline");
  }

  static TemplateDocument parse(String markdown, String source) {
    String raw = markdown == null ? "" : markdown.replace("\r\n", "\n");
    Map<String, Object> meta = Map.of();
    String body = raw;
    Matcher fm = FRONT_MATTER.matcher(raw);
    if (fm.find()) {
      meta = frontMatter(fm.group(1), source);
      body = raw.substring(fm.end());
    }

    List<Section> sections = sections(body);
    String title = string(meta.get("title"));
    if (title == null) {
      title =
          sections.stream()
              .filter(s -> s.level() == 1)
              .map(Section::heading)
              .findFirst()
              .orElse(null);
    }
    DocumentContext context =
        new DocumentContext(
            string(meta.get("document_type")),
            string(meta.get("domain")),
            string(meta.get("language")),
            title,
            sections,
            variables(meta.get("variables")),
            date(meta.get("reference_date"), source));
    return new TemplateDocument(body, context, source);
  }

  private static Map<String, Object> frontMatter(String yaml, String source) {
    try {
      Map<String, Object> parsed =
          JacksonUtility.getYamlMapper().readValue(yaml, new TypeReference<>() {});
      return parsed == null ? Map.of() : parsed;
    } catch (IOException e) {
      throw new TemplateException("Invalid front matter in " + source, e);
    }
  }

  static List<Section> sections(String body) {
    List<Section> sections = new ArrayList<>();
    String heading = "";
    int level = 0;
    int sectionStart = 0;
    List<Paragraph> paragraphs = new ArrayList<>();
    int paraStart = -1;
    int paraEnd = -1;

    int pos = 0;
    while (pos < body.length()) {
      int eol = body.indexOf('\n', pos);
      int lineEnd = eol < 0 ? body.length() : eol;
      String line = body.substring(pos, lineEnd);
      Matcher h = HEADING.matcher(line);
      if (h.matches() || line.isBlank()) {
        if (paraStart >= 0) {
          paragraphs.add(new Paragraph(body.substring(paraStart, paraEnd), paraStart, paraEnd));
          paraStart = -1;
        }
        if (h.matches()) {
          if (level > 0 || !paragraphs.isEmpty()) {
            sections.add(new Section(heading, level, paragraphs, sectionStart, pos));
          }
          heading = h.group(2);
          level = h.group(1).length();
          sectionStart = pos;
          paragraphs = new ArrayList<>();
        }
      } else {
        if (paraStart < 0) {
          paraStart = pos;
        }
        paraEnd = lineEnd;
      }
      pos = lineEnd + 1;
    }
    if (paraStart >= 0) {
      paragraphs.add(new Paragraph(body.substring(paraStart, paraEnd), paraStart, paraEnd));
    }
    if (level > 0 || !paragraphs.isEmpty()) {
      sections.add(new Section(heading, level, paragraphs, sectionStart, body.length()));
    }
    return sections;
  }

  private static Map<String, Object> variables(Object value) {
    if (!(value instanceof Map<?, ?> m)) {
      return Map.of();
    }
    Map<String, Object> out = new LinkedHashMap<>();
    m.forEach((k, v) -> out.put(String.valueOf(k), v));
    return out;
  }

  private static LocalDate date(Object value, String source) {
    String text = string(value);
    if (text == null) {
      return null;
    }
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException e) {
      throw new TemplateException("Invalid reference_date '" + text + "' in " + source, e);
    }
  }

  private static String string(Object value) {
    return value == null || StringUtils.isBlank(value.toString()) ? null : value.toString().trim();
  }
}
