package com.kriskowal.tagyaml;

import java.util.Objects;

/**
 * Source position of a constructed value: the document path (if known), a 1-based line and an
 * optional 1-based column.
 *
 * <p>Instances are immutable. The {@code with*} methods return modified copies.
 */
public final class Origin implements DataTag {

  /** Origin of values whose source is not known. */
  public static final Origin UNKNOWN = new Origin(null, 1, null);

  private final String path;
  private final int lineNum;
  private final Integer colNum;

  public Origin(String path, int lineNum, Integer colNum) {
    if (colNum != null && colNum < 1) {
      throw new IllegalArgumentException("colNum must be >= 1: " + colNum);
    }
    this.path = path;
    this.lineNum = Math.max(lineNum, 1);
    this.colNum = colNum;
  }

  public Origin(String path) {
    this(path, 1, null);
  }

  public String getPath() {
    return path;
  }

  public int getLineNum() {
    return lineNum;
  }

  /** The column, or null when the origin identifies a whole line. */
  public Integer getColNum() {
    return colNum;
  }

  public Origin withPath(String path) {
    return new Origin(path, lineNum, colNum);
  }

  public Origin withLineNum(int lineNum) {
    return new Origin(path, lineNum, colNum);
  }

  public Origin withColNum(Integer colNum) {
    return new Origin(path, lineNum, colNum);
  }

  /** Copy with both line and column replaced. */
  public Origin withPosition(int lineNum, Integer colNum) {
    return new Origin(path, lineNum, colNum);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Origin)) return false;
    Origin other = (Origin) o;
    return lineNum == other.lineNum
        && Objects.equals(path, other.path)
        && Objects.equals(colNum, other.colNum);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, lineNum, colNum);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(path != null ? path : "<unknown>");
    sb.append(':').append(lineNum);
    if (colNum != null) {
      sb.append(':').append(colNum);
    }
    return sb.toString();
  }
}
