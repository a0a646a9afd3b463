package com.scholary.mp3.converter.transcode;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Converts an audio stream into the target format.
 *
 * <p>Blocks until the output has been fully written. Neither stream is closed by the transcoder.
 */
public interface Transcoder {

  /**
   * Transcode {@code input} into {@code output}.
   *
   * <p>The listener is called on the transcoding thread, zero or more times, with the fraction
   * complete in [0.0, 1.0]. An exception thrown by the listener aborts the transcode and is
   * rethrown unchanged.
   *
   * @throws TranscodeException if the conversion fails
   */
  void transcode(
      InputStream input, OutputStream output, TranscodeOptions options, ProgressListener listener);
}
