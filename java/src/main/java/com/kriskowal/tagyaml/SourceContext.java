package com.kriskowal.tagyaml;

import java.util.*;

/**
 * Excerpt of the source around an error: up to two preceding lines, the target line, and a
 * marker under the target column.
 */
final class SourceContext {

  private static final int CONTEXT_LINE_COUNT = 2;
  private static final int MAX_ANNOTATED_LINE_WIDTH = 120;
  private static final String TRUNCATION_MARKER = "...";

  private final Origin origin;
  private final List<String> annotatedLines;
  private final String targetLine;

  private SourceContext(Origin origin, List<String> annotatedLines, String targetLine) {
    this.origin = origin;
    this.annotatedLines = annotatedLines;
    this.targetLine = targetLine;
  }

  /** Split source text into lines; a CRLF counts as one line break. */
  static String[] lines(String text) {
    return text.split("\r?\n", -1);
  }

  /**
   * Build the excerpt for a 0-based line of {@code text}. Labels are taken from {@code origin},
   * which may be offset from the text's own line numbers.
   */
  static SourceContext fromText(String text, int lineIndex, Origin origin) {
    String[] lines = lines(text);
    if (lineIndex < 0 || lineIndex >= lines.length) {
      return new SourceContext(
          origin, Collections.singletonList("(source not shown: file truncated)"), null);
    }

    int targetLineNum = origin.getLineNum();
    int startIndex = Math.max(0, lineIndex - CONTEXT_LINE_COUNT);
    int labelWidth = String.valueOf(targetLineNum).length();
    int maxLineLength = MAX_ANNOTATED_LINE_WIDTH - labelWidth - 1;
    int usableLineLength = maxLineLength;

    List<String> annotated = new ArrayList<>();
    for (int i = startIndex; i <= lineIndex; i++) {
      String line = lines[i].replace('\t', ' ');
      if (line.length() > maxLineLength) {
        line = line.substring(0, maxLineLength - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
        usableLineLength = maxLineLength - TRUNCATION_MARKER.length();
      }
      String label = padLeft(String.valueOf(targetLineNum - (lineIndex - i)), labelWidth);
      annotated.add(label + (line.isEmpty() ? "" : " ") + line);
    }

    Integer colNum = origin.getColNum();
    if (colNum != null && colNum >= 1 && colNum <= usableLineLength) {
      String marker = "column " + colNum;
      int colIndex = colNum - 1;
      if (colIndex + 2 + marker.length() > maxLineLength) {
        marker = spaces(colIndex - marker.length() - 1) + marker + " ^";
      } else {
        marker = spaces(colIndex) + "^ " + marker;
      }
      annotated.add(spaces(labelWidth) + " " + marker);
    } else if (colNum == null) {
      String last = annotated.get(annotated.size() - 1);
      annotated.add(spaces(labelWidth) + " " + "^".repeat(Math.max(0, last.length() - labelWidth - 1)));
    }

    return new SourceContext(origin, annotated, lines[lineIndex]);
  }

  Origin getOrigin() {
    return origin;
  }

  /** The raw target line, or null when the source did not contain it. */
  String getTargetLine() {
    return targetLine;
  }

  List<String> getAnnotatedLines() {
    return annotatedLines;
  }

  private static String padLeft(String s, int width) {
    return spaces(width - s.length()) + s;
  }

  private static String spaces(int count) {
    return " ".repeat(Math.max(0, count));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Origin: ").append(origin);
    if (!annotatedLines.isEmpty()) {
      sb.append("\n\n").append(String.join("\n", annotatedLines));
    }
    return sb.toString();
  }
}
