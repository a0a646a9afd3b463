package com.scholary.mp3.converter.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.mp3.converter.artifact.ArtifactLifecycle;
import com.scholary.mp3.converter.artifact.ArtifactStorage;
import com.scholary.mp3.converter.artifact.ArtifactStorageException;
import com.scholary.mp3.converter.artifact.LocalArtifactStorage;
import com.scholary.mp3.converter.config.ConversionProperties;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.InMemoryJobStore;
import com.scholary.mp3.converter.job.JobPatch;
import com.scholary.mp3.converter.job.JobStatus;
import com.scholary.mp3.converter.job.JobStore;
import com.scholary.mp3.converter.job.JobStoreException;
import com.scholary.mp3.converter.source.AudioQuality;
import com.scholary.mp3.converter.source.MediaMetadata;
import com.scholary.mp3.converter.source.MediaSource;
import com.scholary.mp3.converter.source.SourceUnavailableException;
import com.scholary.mp3.converter.transcode.ProgressListener;
import com.scholary.mp3.converter.transcode.TranscodeException;
import com.scholary.mp3.converter.transcode.TranscodeOptions;
import com.scholary.mp3.converter.transcode.Transcoder;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

@ExtendWith(MockitoExtension.class)
class ConversionPipelineTest {

  private static final String URL = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Mock private MediaSource mediaSource;
  @Mock private Transcoder transcoder;

  @TempDir Path tempDir;

  private InMemoryJobStore jobStore;
  private LocalArtifactStorage artifactStorage;
  private ConversionPipeline pipeline;

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @BeforeEach
  void setUp() {
    jobStore = new InMemoryJobStore(0, Duration.ZERO, clock, job -> {});
    artifactStorage = new LocalArtifactStorage(tempDir);
    pipeline = pipelineWith(jobStore, artifactStorage);
  }

  private ConversionPipeline pipelineWith(JobStore store, ArtifactStorage storage) {
    ConversionProperties properties =
        new ConversionProperties(2, 10, 10, 128, "mp3", AudioQuality.HIGHEST);
    return new ConversionPipeline(
        store,
        mediaSource,
        transcoder,
        storage,
        new ArtifactLifecycle(store, storage),
        properties,
        clock);
  }

  private void givenSource(String title, Double duration) {
    when(mediaSource.fetchMetadata(URL)).thenReturn(new MediaMetadata(title, duration));
    when(mediaSource.openAudioStream(URL, AudioQuality.HIGHEST))
        .thenReturn(new ByteArrayInputStream("raw-audio".getBytes(StandardCharsets.UTF_8)));
  }

  private void givenTranscoder(Answer<Void> answer) {
    doAnswer(answer)
        .when(transcoder)
        .transcode(
            any(InputStream.class),
            any(OutputStream.class),
            any(TranscodeOptions.class),
            any(ProgressListener.class));
  }

  private List<Path> artifactFiles() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.toList();
    }
  }

  @Test
  void successfulRunCompletesJobWithArtifact() throws IOException {
    ConversionJob job = jobStore.create(URL);
    givenSource("Never Gonna Give You Up (Official Video)!", 212.0);
    List<Integer> observedProgress = new ArrayList<>();
    givenTranscoder(
        invocation -> {
          TranscodeOptions options = invocation.getArgument(2);
          assertThat(options.expectedDurationSeconds()).isEqualTo(212.0);
          assertThat(options.bitrateKbps()).isEqualTo(128);
          OutputStream out = invocation.getArgument(1);
          out.write("mp3!".getBytes(StandardCharsets.UTF_8));
          ProgressListener listener = invocation.getArgument(3);
          listener.onProgress(0.5);
          observedProgress.add(jobStore.get(job.id()).orElseThrow().progress());
          listener.onProgress(1.0);
          observedProgress.add(jobStore.get(job.id()).orElseThrow().progress());
          return null;
        });

    pipeline.run(job.id());

    ConversionJob done = jobStore.get(job.id()).orElseThrow();
    assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(done.progress()).isEqualTo(100);
    assertThat(done.title()).isEqualTo("Never Gonna Give You Up Official Video");
    assertThat(done.fileName())
        .isEqualTo("Never Gonna Give You Up Official Video_" + job.id() + ".mp3");
    assertThat(done.artifactKey()).isEqualTo(job.id() + "_" + NOW.toEpochMilli() + ".mp3");
    assertThat(done.fileSize()).isEqualTo(4L);
    assertThat(done.completedAt()).isEqualTo(NOW);
    assertThat(done.errorMessage()).isNull();
    assertThat(artifactStorage.exists(done.artifactKey())).isTrue();
    assertThat(observedProgress).containsExactly(50, 95);
  }

  @Test
  void metadataFailureMarksJobFailed() throws IOException {
    ConversionJob job = jobStore.create(URL);
    when(mediaSource.fetchMetadata(URL))
        .thenThrow(new SourceUnavailableException("Video unavailable"));

    pipeline.run(job.id());

    ConversionJob failed = jobStore.get(job.id()).orElseThrow();
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.errorMessage()).isEqualTo("Video unavailable");
    assertThat(failed.title()).isNull();
    assertThat(failed.artifactKey()).isNull();
    verifyNoInteractions(transcoder);
    assertThat(artifactFiles()).isEmpty();
  }

  @Test
  void transcodeFailureDiscardsPartialOutput() throws IOException {
    ConversionJob job = jobStore.create(URL);
    givenSource("Song", 60.0);
    givenTranscoder(
        invocation -> {
          OutputStream out = invocation.getArgument(1);
          out.write(new byte[] {1, 2, 3});
          throw new TranscodeException("ffmpeg exited with code 1: Invalid data found");
        });

    pipeline.run(job.id());

    ConversionJob failed = jobStore.get(job.id()).orElseThrow();
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.errorMessage()).contains("Invalid data found");
    assertThat(failed.title()).isEqualTo("Song");
    assertThat(failed.progress()).isEqualTo(ConversionPipeline.METADATA_PROGRESS);
    assertThat(artifactFiles()).isEmpty();
  }

  @Test
  void failureWithoutMessageUsesGenericText() {
    ConversionJob job = jobStore.create(URL);
    when(mediaSource.fetchMetadata(URL)).thenThrow(new IllegalStateException());

    pipeline.run(job.id());

    assertThat(jobStore.get(job.id()).orElseThrow().errorMessage())
        .isEqualTo(ConversionPipeline.UNKNOWN_ERROR);
  }

  @Test
  void deletionDuringTranscodeStopsQuietly() throws IOException {
    ConversionJob job = jobStore.create(URL);
    givenSource("Song", 60.0);
    givenTranscoder(
        invocation -> {
          OutputStream out = invocation.getArgument(1);
          out.write(new byte[] {1, 2, 3});
          jobStore.delete(job.id());
          ProgressListener listener = invocation.getArgument(3);
          listener.onProgress(0.4);
          return null;
        });

    pipeline.run(job.id());

    assertThat(jobStore.get(job.id())).isEmpty();
    assertThat(jobStore.list()).isEmpty();
    assertThat(artifactFiles()).isEmpty();
  }

  @Test
  void deletionBeforeCompletionDiscardsArtifact() throws IOException {
    ConversionJob job = jobStore.create(URL);
    givenSource("Song", 60.0);
    givenTranscoder(
        invocation -> {
          OutputStream out = invocation.getArgument(1);
          out.write(new byte[] {1, 2, 3});
          jobStore.delete(job.id());
          return null;
        });

    pipeline.run(job.id());

    assertThat(jobStore.get(job.id())).isEmpty();
    assertThat(artifactFiles()).isEmpty();
  }

  @Test
  void jobStoreOutageStopsWithoutRecordingFailure() throws IOException {
    List<JobPatch> applied = new ArrayList<>();
    InMemoryJobStore flakyStore =
        new InMemoryJobStore(0, Duration.ZERO, clock, job -> {}) {
          @Override
          public Optional<ConversionJob> update(long id, JobPatch patch) {
            if (patch.status() == null
                && patch.progress() != null
                && patch.progress() > ConversionPipeline.METADATA_PROGRESS) {
              throw new JobStoreException("Job store unreachable");
            }
            applied.add(patch);
            return super.update(id, patch);
          }
        };
    ConversionJob job = flakyStore.create(URL);
    givenSource("Song", 60.0);
    givenTranscoder(
        invocation -> {
          OutputStream out = invocation.getArgument(1);
          out.write(new byte[] {1, 2, 3});
          ProgressListener listener = invocation.getArgument(3);
          listener.onProgress(0.5);
          return null;
        });

    pipelineWith(flakyStore, artifactStorage).run(job.id());

    ConversionJob stalled = flakyStore.get(job.id()).orElseThrow();
    assertThat(stalled.status()).isEqualTo(JobStatus.PROCESSING);
    assertThat(stalled.progress()).isEqualTo(ConversionPipeline.METADATA_PROGRESS);
    assertThat(stalled.errorMessage()).isNull();
    assertThat(applied).noneMatch(patch -> patch.status() == JobStatus.FAILED);
    assertThat(artifactFiles()).isEmpty();
  }

  @Test
  void unreadableArtifactSizeMarksJobFailed() throws IOException {
    LocalArtifactStorage brokenSize =
        new LocalArtifactStorage(tempDir) {
          @Override
          public long size(String key) {
            throw new ArtifactStorageException("Failed to read artifact size: " + key);
          }
        };
    ConversionJob job = jobStore.create(URL);
    givenSource("Song", 60.0);
    givenTranscoder(
        invocation -> {
          OutputStream out = invocation.getArgument(1);
          out.write(new byte[] {1, 2, 3});
          return null;
        });

    pipelineWith(jobStore, brokenSize).run(job.id());

    ConversionJob failed = jobStore.get(job.id()).orElseThrow();
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.errorMessage()).startsWith("Failed to read artifact size");
    assertThat(failed.artifactKey()).isNull();
    assertThat(artifactFiles()).isEmpty();
  }

  @Test
  void missingJobIsIgnored() {
    pipeline.run(404);

    verifyNoInteractions(mediaSource, transcoder);
    assertThat(jobStore.list()).isEmpty();
  }

  @Test
  void sourceStreamFailureMarksJobFailed() {
    ConversionJob job = jobStore.create(URL);
    when(mediaSource.fetchMetadata(URL)).thenReturn(new MediaMetadata("Song", null));
    doThrow(new SourceUnavailableException("Failed to start yt-dlp"))
        .when(mediaSource)
        .openAudioStream(anyString(), any(AudioQuality.class));

    pipeline.run(job.id());

    ConversionJob failed = jobStore.get(job.id()).orElseThrow();
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.errorMessage()).isEqualTo("Failed to start yt-dlp");
  }

  @Test
  void progressIsClampedToTranscodeBand() {
    assertThat(ConversionPipeline.toPercent(0.0)).isEqualTo(15);
    assertThat(ConversionPipeline.toPercent(0.1)).isEqualTo(15);
    assertThat(ConversionPipeline.toPercent(0.42)).isEqualTo(42);
    assertThat(ConversionPipeline.toPercent(0.99)).isEqualTo(95);
    assertThat(ConversionPipeline.toPercent(1.0)).isEqualTo(95);
  }
}
