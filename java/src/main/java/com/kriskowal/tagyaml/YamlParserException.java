package com.kriskowal.tagyaml;

/**
 * The single failure type of a load. The message is already normalized; the SnakeYAML failure it
 * was derived from is kept as the cause but its text is not repeated.
 */
public class YamlParserException extends RuntimeException {

  private final Origin origin;
  private final String formattedSourceContext;
  private final String helpText;

  public YamlParserException(
      String message,
      Origin origin,
      String formattedSourceContext,
      String helpText,
      Throwable cause) {
    super(message, cause);
    this.origin = origin;
    this.formattedSourceContext = formattedSourceContext;
    this.helpText = helpText;
  }

  /** Best known location of the failure. */
  public Origin getOrigin() {
    return origin;
  }

  /** Annotated source excerpt, or null when the failure has no position. */
  public String getFormattedSourceContext() {
    return formattedSourceContext;
  }

  public String getHelpText() {
    return helpText;
  }

  /** Message, source excerpt and help text, separated by blank lines. */
  public String describe() {
    StringBuilder sb = new StringBuilder(getMessage());
    if (formattedSourceContext != null) {
      sb.append("\n\n").append(formattedSourceContext);
    }
    if (helpText != null) {
      sb.append("\n\n").append(helpText);
    }
    return sb.toString();
  }
}
