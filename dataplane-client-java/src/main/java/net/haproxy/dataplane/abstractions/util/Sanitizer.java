package net.haproxy.dataplane.abstractions.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credentials from diagnostic text (request bodies, API error messages) before it is logged.
 */
public class Sanitizer {

  public static final String MASK = "***";

  private static final String[] SENSITIVE_FIELDS = { "password", "token", "secret", "key", "auth" };

  private static final List<Pattern> FIELD_PATTERNS = new ArrayList<>();

  private static final Pattern INVALID_PASSWORD_PATTERN = Pattern.compile("invalid password:\\s*[^\\s\"]*");

  static {
    for (String field : SENSITIVE_FIELDS) {
      FIELD_PATTERNS.add(Pattern.compile("\"(" + field + ")\":\\s*\"[^\"]*\""));
    }
  }

  private Sanitizer() {
    // utility
  }

  public static String sanitize(String text) {
    if (text == null) {
      return null;
    }
    String result = text;
    for (Pattern pattern : FIELD_PATTERNS) {
      result = pattern.matcher(result).replaceAll("\"$1\": \"" + Matcher.quoteReplacement(MASK) + "\"");
    }
    return INVALID_PASSWORD_PATTERN.matcher(result).replaceAll("invalid password: " + Matcher.quoteReplacement(MASK));
  }

}
