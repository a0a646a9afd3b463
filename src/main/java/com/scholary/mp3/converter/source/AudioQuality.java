package com.scholary.mp3.converter.source;

/** Quality hint for the audio stream fetch. */
public enum AudioQuality {
  HIGHEST("bestaudio"),
  LOWEST("worstaudio");

  private final String formatSelector;

  AudioQuality(String formatSelector) {
    this.formatSelector = formatSelector;
  }

  /** yt-dlp {@code -f} selector for this quality. */
  public String formatSelector() {
    return formatSelector;
  }
}
