package com.gentoro.verifier.prompt;

import com.gentoro.verifier.exception.StateException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Plain-text template with {@code {{name}}} placeholders. Rendering is deterministic. */
public final class PromptTemplate {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

  private final String name;
  private final String text;

  public PromptTemplate(String name, String text) {
    this.name = name;
    this.text = text;
  }

  public String name() {
    return name;
  }

  public String text() {
    return text;
  }

  /**
   * Substitute every placeholder with the string form of its value.
   *
   * @throws StateException when a placeholder has no value; a half-rendered prompt is a defect.
   */
  public String render(Map<String, ?> values) {
    Matcher m = PLACEHOLDER.matcher(text);
    StringBuilder sb = new StringBuilder(text.length() + 64);
    while (m.find()) {
      String key = m.group(1);
      if (!values.containsKey(key)) {
        throw new StateException("Prompt '%s' has no value for '%s'".formatted(name, key));
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(values.get(key))));
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
