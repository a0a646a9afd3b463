package com.scholary.mp3.converter.transcode;

/** Receives transcoding progress as a fraction in [0.0, 1.0]. Calls are not guaranteed ordered. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = fraction -> {};

  void onProgress(double fraction);
}
