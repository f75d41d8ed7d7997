package com.memo.ontology.utility;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class StringUtility {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private StringUtility() {}

  /** Number of whitespace-separated, non-empty tokens. */
  public static int wordCount(String text) {
    if (text == null || text.isBlank()) return 0;
    int count = 0;
    for (String token : WHITESPACE.split(text.trim())) {
      if (!token.isEmpty()) count++;
    }
    return count;
  }

  /** Cuts {@code text} to at most {@code max} characters; null stays null. */
  public static String truncate(String text, int max) {
    if (text == null || max < 0 || text.length() <= max) return text;
    return text.substring(0, max);
  }

  /**
   * Returns the body of the first fenced block of the given type (e.g. {@code ```json ... ```}),
   * or null when the text carries no such block.
   */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }

    String regex = "(?s)(?:```%s\\s*)(.+?)(?:\\s*```)".formatted(type);
    Pattern pattern = Pattern.compile(regex);
    Matcher matcher = pattern.matcher(text);

    if (matcher.find()) {
      return matcher.group(1).trim();
    }

    return null;
  }

  /** Strips an optional ```json fence around a model response. */
  public static String unwrapJson(String response) {
    if (response == null) return null;
    String snippet = extractSnippet(response, "json");
    if (snippet == null) snippet = extractSnippet(response, "");
    return snippet != null ? snippet : response.trim();
  }
}
