package com.kriskowal.tagyaml;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;

/**
 * Turns a load failure into one {@link YamlParserException}. For positioned SnakeYAML failures
 * the offending source line is checked against a few common mistakes (tabs, unquoted templates,
 * unquoted colons, unbalanced quotes) and a match replaces the reported message and column.
 *
 * <p>The checks look at one line of text only and may guess wrong; they never re-parse.
 */
final class ErrorClassifier {

  static final String PARSE_FAILED = "YAML parsing failed";

  // optional "- " list markers and an optional "key: " ahead of the value
  private static final String PREAMBLE = "^\\s*(?:-\\s+)*(?:[\\w\\s]+:\\s+)?";

  private static final Pattern TEMPLATE = Pattern.compile(PREAMBLE + "(?<value>\\{\\{.*\\}\\})");
  private static final Pattern VALUE = Pattern.compile(PREAMBLE + "(?<value>.*)$");
  private static final Pattern QUOTED_RUN = Pattern.compile("([\"']).*?\\1");
  private static final Pattern BARE_COLON = Pattern.compile(":(?:$| )");
  private static final Pattern QUOTED_VALUE = Pattern.compile(PREAMBLE + "(?<value>[\"'].*?)\\s*$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  static final String TAB_MESSAGE = "Tabs are usually invalid in YAML.";

  static final String TEMPLATE_MESSAGE =
      "This may be an issue with missing quotes around a template block.";
  private static final String TEMPLATE_HELP =
      "For example:\n\n    raw: {{ some_var }}\n\nShould be:\n\n    raw: \"{{ some_var }}\"";

  static final String COLON_MESSAGE =
      "Colons in unquoted values must be followed by a non-space character.";
  private static final String COLON_HELP =
      "For example:\n\n    raw: echo name: value\n\nShould be:\n\n    raw: \"echo name: value\"";

  static final String UNCLOSED_QUOTE_MESSAGE =
      "Values starting with a quote must end with the same quote.";
  private static final String UNCLOSED_QUOTE_HELP =
      "For example:\n\n    raw: \"foo\" in bar\n\nShould be:\n\n    raw: '\"foo\" in bar'";

  static final String REUSED_QUOTE_MESSAGE =
      "Values starting with a quote must end with the same quote, and not contain that quote.";
  private static final String REUSED_QUOTE_HELP =
      "For example:\n\n    raw: \"foo\" in \"bar\"\n\nShould be:\n\n    raw: '\"foo\" in \"bar\"'";

  private ErrorClassifier() {}

  static YamlParserException classify(Exception ex, String source, Origin baseOrigin) {
    Mark mark = problemMark(ex);
    if (mark == null) {
      String text = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
      return new YamlParserException(message(text), baseOrigin, null, null, ex);
    }

    MarkedYAMLException marked = (MarkedYAMLException) ex;
    int lineIndex = mark.getLine();
    String[] lines = SourceContext.lines(source);
    String targetLine = lineIndex < lines.length ? lines[lineIndex] : "";

    Diagnosis diagnosis = null;
    if (!(ex instanceof StructuralConstructionException)) {
      diagnosis = diagnose(targetLine);
    }

    String text;
    int colNum;
    String helpText;
    if (diagnosis != null) {
      text = diagnosis.message;
      colNum = diagnosis.colNum;
      helpText = diagnosis.helpText;
    } else {
      text = describe(marked);
      colNum = mark.getColumn() + 1;
      helpText = null;
    }

    Origin origin = baseOrigin.withPosition(lineIndex + baseOrigin.getLineNum(), colNum);
    SourceContext context = SourceContext.fromText(source, lineIndex, origin);
    return new YamlParserException(message(text), origin, context.toString(), helpText, ex);
  }

  private static Mark problemMark(Exception ex) {
    if (!(ex instanceof MarkedYAMLException)) {
      return null;
    }
    MarkedYAMLException marked = (MarkedYAMLException) ex;
    return marked.getProblemMark() != null ? marked.getProblemMark() : marked.getContextMark();
  }

  /** Match the line against known mistakes, in order. Null when none applies. */
  static Diagnosis diagnose(String line) {
    int tab = line.indexOf('\t');
    if (tab >= 0) {
      return new Diagnosis(TAB_MESSAGE, column(line, tab), null);
    }

    Matcher template = TEMPLATE.matcher(line);
    if (template.find()) {
      return new Diagnosis(
          TEMPLATE_MESSAGE, column(line, template.start("value")), TEMPLATE_HELP);
    }

    if (!line.trim().startsWith(":")) {
      Matcher value = VALUE.matcher(line);
      if (value.find()) {
        // colons inside a quoted run are fine
        Matcher colon = BARE_COLON.matcher(maskQuotedRun(value.group("value")));
        if (colon.find()) {
          return new Diagnosis(
              COLON_MESSAGE, column(line, value.start("value") + colon.start()), COLON_HELP);
        }
      }
    }

    Matcher quoted = QUOTED_VALUE.matcher(line);
    if (quoted.find()) {
      String value = quoted.group("value");
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      int col = column(line, quoted.start("value"));
      if (first != last) {
        return new Diagnosis(UNCLOSED_QUOTE_MESSAGE, col, UNCLOSED_QUOTE_HELP);
      }
      if (count(value, first) > 2) {
        return new Diagnosis(REUSED_QUOTE_MESSAGE, col, REUSED_QUOTE_HELP);
      }
    }

    return null;
  }

  /** 1-based column of a char index, counted in code points like SnakeYAML marks. */
  private static int column(String line, int index) {
    return line.codePointCount(0, index) + 1;
  }

  private static String maskQuotedRun(String value) {
    Matcher run = QUOTED_RUN.matcher(value);
    if (!run.find()) {
      return value;
    }
    return value.substring(0, run.start())
        + "x".repeat(run.end() - run.start())
        + value.substring(run.end());
  }

  private static int count(String s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) n++;
    }
    return n;
  }

  /** SnakeYAML context and problem as sentences. */
  private static String describe(MarkedYAMLException ex) {
    List<String> parts = new ArrayList<>();
    for (String part : new String[] {ex.getContext(), ex.getProblem()}) {
      if (part == null || part.trim().isEmpty()) {
        continue;
      }
      String sentence = part.trim();
      sentence = Character.toUpperCase(sentence.charAt(0)) + sentence.substring(1);
      if (!sentence.endsWith(".")) {
        sentence += ".";
      }
      parts.add(sentence);
    }
    if (parts.isEmpty()) {
      return ex.getMessage();
    }
    return String.join(" ", parts);
  }

  /** "YAML parsing failed: detail", with whitespace runs collapsed. */
  private static String message(String detail) {
    return PARSE_FAILED + ": " + WHITESPACE.matcher(detail.trim()).replaceAll(" ");
  }

  static final class Diagnosis {
    final String message;
    final int colNum;
    final String helpText;

    Diagnosis(String message, int colNum, String helpText) {
      this.message = message;
      this.colNum = colNum;
      this.helpText = helpText;
    }
  }
}
