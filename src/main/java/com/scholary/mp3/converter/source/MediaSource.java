package com.scholary.mp3.converter.source;

import java.io.InputStream;

/**
 * Where conversion input comes from.
 *
 * <p>This abstraction allows swapping the extraction tool (yt-dlp today) without touching the
 * pipeline. Both fetch operations block the calling thread until the source answers.
 */
public interface MediaSource {

  /** Whether this source can handle the given URL at all. Must not perform network calls. */
  boolean supports(String url);

  /**
   * Fetch descriptive metadata for a media URL.
   *
   * @throws SourceUnavailableException if the media cannot be resolved
   */
  MediaMetadata fetchMetadata(String url);

  /**
   * Open the raw audio stream for a media URL. The caller must close the stream.
   *
   * <p>Failures that only show up while streaming are raised from the stream's read methods as
   * {@link SourceUnavailableException}.
   *
   * @throws SourceUnavailableException if the stream cannot be started
   */
  InputStream openAudioStream(String url, AudioQuality quality);
}
