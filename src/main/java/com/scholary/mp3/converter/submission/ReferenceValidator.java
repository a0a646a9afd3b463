package com.scholary.mp3.converter.submission;

import com.scholary.mp3.converter.source.MediaSource;
import java.net.URI;
import java.net.URISyntaxException;
import org.springframework.stereotype.Component;

/**
 * Checks that a submitted URL is well formed and that the media source can handle it.
 *
 * <p>Purely local: no network calls, so a batch can be validated in full before anything is
 * created.
 */
@Component
public class ReferenceValidator {

  private final MediaSource mediaSource;

  public ReferenceValidator(MediaSource mediaSource) {
    this.mediaSource = mediaSource;
  }

  /**
   * @throws InvalidSubmissionException if the URL is blank, malformed or unsupported
   */
  public void validate(String url) {
    if (url == null || url.isBlank()) {
      throw new InvalidSubmissionException("URL must not be blank");
    }
    if (!isWellFormed(url.trim())) {
      throw new InvalidSubmissionException("Malformed URL: " + url);
    }
    if (!mediaSource.supports(url.trim())) {
      throw new InvalidSubmissionException("Invalid YouTube URL: " + url);
    }
  }

  private static boolean isWellFormed(String url) {
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme();
      return uri.getHost() != null
          && scheme != null
          && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"));
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
