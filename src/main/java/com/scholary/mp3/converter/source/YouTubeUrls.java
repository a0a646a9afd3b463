package com.scholary.mp3.converter.source;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes YouTube video URLs and extracts their video id.
 *
 * <p>Accepted shapes:
 *
 * <ul>
 *   <li>{@code https://www.youtube.com/watch?v=ID} (also m., music., gaming. hosts)
 *   <li>{@code https://youtu.be/ID}
 *   <li>{@code https://www.youtube.com/shorts/ID}, {@code /embed/ID}, {@code /v/ID}, {@code
 *       /live/ID}
 *   <li>{@code https://www.youtube-nocookie.com/embed/ID}
 * </ul>
 */
public final class YouTubeUrls {

  private static final Set<String> WATCH_HOSTS =
      Set.of(
          "youtube.com",
          "www.youtube.com",
          "m.youtube.com",
          "music.youtube.com",
          "gaming.youtube.com",
          "youtube-nocookie.com",
          "www.youtube-nocookie.com");

  private static final Set<String> SHORT_HOSTS = Set.of("youtu.be", "www.youtu.be");

  private static final Pattern VIDEO_ID = Pattern.compile("^[a-zA-Z0-9_-]{11}$");
  private static final Pattern PATH_ID =
      Pattern.compile("^/(?:embed|v|shorts|live)/([^/?#]+)");
  private static final Pattern V_PARAM = Pattern.compile("(?:^|&)v=([^&]*)");

  private YouTubeUrls() {}

  public static boolean isValid(String url) {
    return videoId(url).isPresent();
  }

  public static Optional<String> videoId(String url) {
    if (url == null) {
      return Optional.empty();
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      return Optional.empty();
    }
    String scheme = uri.getScheme();
    String host = uri.getHost();
    if (scheme == null
        || host == null
        || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      return Optional.empty();
    }
    host = host.toLowerCase(Locale.ROOT);
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();

    String candidate = null;
    if (SHORT_HOSTS.contains(host)) {
      String[] segments = path.split("/");
      candidate = segments.length > 1 ? segments[1] : null;
    } else if (WATCH_HOSTS.contains(host)) {
      Matcher pathMatcher = PATH_ID.matcher(path);
      if (pathMatcher.find()) {
        candidate = pathMatcher.group(1);
      } else if (uri.getRawQuery() != null) {
        Matcher paramMatcher = V_PARAM.matcher(uri.getRawQuery());
        if (paramMatcher.find()) {
          candidate = paramMatcher.group(1);
        }
      }
    }

    if (candidate == null || !VIDEO_ID.matcher(candidate).matches()) {
      return Optional.empty();
    }
    return Optional.of(candidate);
  }
}
