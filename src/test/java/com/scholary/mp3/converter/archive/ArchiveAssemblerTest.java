package com.scholary.mp3.converter.archive;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.mp3.converter.artifact.LocalArtifactStorage;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.InMemoryJobStore;
import com.scholary.mp3.converter.job.JobPatch;
import com.scholary.mp3.converter.job.JobStatus;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveAssemblerTest {

  private static final String URL = "https://youtu.be/dQw4w9WgXcQ";

  @TempDir Path tempDir;

  private InMemoryJobStore jobStore;
  private LocalArtifactStorage storage;
  private ArchiveAssembler assembler;

  @BeforeEach
  void setUp() {
    jobStore = new InMemoryJobStore();
    storage = new LocalArtifactStorage(tempDir);
    assembler = new ArchiveAssembler(jobStore, storage);
  }

  private ConversionJob completed(String title, String content) throws IOException {
    ConversionJob job = jobStore.create(URL);
    jobStore.update(job.id(), JobPatch.builder().status(JobStatus.PROCESSING).title(title).build());
    String key = job.id() + "_1.mp3";
    try (OutputStream out = storage.openWrite(key)) {
      out.write(content.getBytes(StandardCharsets.UTF_8));
    }
    return jobStore
        .update(
            job.id(),
            JobPatch.completed(key, title + ".mp3", content.length(), Instant.now()))
        .orElseThrow();
  }

  private ConversionJob failed() {
    ConversionJob job = jobStore.create(URL);
    return jobStore.update(job.id(), JobPatch.failed("Video unavailable")).orElseThrow();
  }

  private static Map<String, String> unzip(byte[] archive) throws IOException {
    Map<String, String> entries = new LinkedHashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return entries;
  }

  @Test
  void archivesOnlyCompletedJobs() throws IOException {
    ConversionJob done = completed("Song", "song-bytes");
    ConversionJob broken = failed();

    ArchivePlan plan = assembler.plan(List.of(done.id(), broken.id(), 999L)).orElseThrow();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    int written = assembler.write(plan, out);

    assertThat(plan.archiveName()).isEqualTo("converted_files.zip");
    assertThat(written).isEqualTo(1);
    assertThat(unzip(out.toByteArray())).containsExactly(Map.entry("Song.mp3", "song-bytes"));
  }

  @Test
  void nothingDownloadableYieldsNoPlan() {
    ConversionJob pending = jobStore.create(URL);
    ConversionJob broken = failed();

    assertThat(assembler.plan(List.of(pending.id(), broken.id(), 12345L))).isEmpty();
    assertThat(assembler.plan(List.of())).isEmpty();
  }

  @Test
  void keepsRequestOrderAndIgnoresDuplicateIds() throws IOException {
    ConversionJob first = completed("First", "1");
    ConversionJob second = completed("Second", "2");

    ArchivePlan plan =
        assembler.plan(List.of(second.id(), first.id(), second.id())).orElseThrow();

    assertThat(plan.jobs()).extracting(ConversionJob::id).containsExactly(second.id(), first.id());
  }

  @Test
  void skipsArtifactRemovedAfterPlanning() throws IOException {
    ConversionJob kept = completed("Kept", "kept");
    ConversionJob removed = completed("Removed", "removed");
    ArchivePlan plan = assembler.plan(List.of(kept.id(), removed.id())).orElseThrow();

    storage.remove(removed.artifactKey());
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    int written = assembler.write(plan, out);

    assertThat(written).isEqualTo(1);
    assertThat(unzip(out.toByteArray())).containsOnlyKeys("Kept.mp3");
  }

  @Test
  void duplicateFileNamesGetSuffixes() throws IOException {
    ConversionJob a = completed("Same", "a");
    ConversionJob b = completed("Same", "b");

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    assembler.write(assembler.plan(List.of(a.id(), b.id())).orElseThrow(), out);

    assertThat(unzip(out.toByteArray()))
        .containsExactly(Map.entry("Same.mp3", "a"), Map.entry("Same (1).mp3", "b"));
  }

  @Test
  void uniqueNameHandlesMissingExtension() {
    Set<String> used = new HashSet<>();

    assertThat(ArchiveAssembler.uniqueName("track", used)).isEqualTo("track");
    assertThat(ArchiveAssembler.uniqueName("track", used)).isEqualTo("track (1)");
    assertThat(ArchiveAssembler.uniqueName("track", used)).isEqualTo("track (2)");
  }
}
