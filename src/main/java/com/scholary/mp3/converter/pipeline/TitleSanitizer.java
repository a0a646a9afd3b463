package com.scholary.mp3.converter.pipeline;

import java.util.regex.Pattern;

/** Makes media titles safe to use inside file names. */
public final class TitleSanitizer {

  static final String FALLBACK_TITLE = "audio";

  // Keeps ASCII word characters, whitespace and hyphens
  private static final Pattern UNSAFE = Pattern.compile("[^\\w\\s-]");

  private TitleSanitizer() {}

  public static String sanitize(String rawTitle) {
    if (rawTitle == null) {
      return FALLBACK_TITLE;
    }
    String cleaned = UNSAFE.matcher(rawTitle).replaceAll("").trim();
    return cleaned.isEmpty() ? FALLBACK_TITLE : cleaned;
  }
}
