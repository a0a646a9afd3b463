package com.scholary.mp3.converter.archive;

import com.scholary.mp3.converter.artifact.ArtifactNotFoundException;
import com.scholary.mp3.converter.artifact.ArtifactStorage;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.JobStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bundles the artifacts of several completed jobs into one ZIP archive.
 *
 * <p>Assembly has two phases. {@link #plan} resolves the requested ids and keeps only completed
 * jobs with an artifact; an empty result means "nothing to download". {@link #write} then streams
 * entries one by one. An artifact removed between the two phases is skipped, not fatal.
 */
@Service
public class ArchiveAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveAssembler.class);

  public static final String ARCHIVE_NAME = "converted_files.zip";

  private final JobStore jobStore;
  private final ArtifactStorage artifactStorage;

  public ArchiveAssembler(JobStore jobStore, ArtifactStorage artifactStorage) {
    this.jobStore = jobStore;
    this.artifactStorage = artifactStorage;
  }

  /**
   * Select the jobs to archive.
   *
   * @param jobIds requested ids, in the order entries should appear
   * @return empty if none of the ids refers to a downloadable job
   */
  public Optional<ArchivePlan> plan(List<Long> jobIds) {
    List<ConversionJob> eligible =
        jobIds.stream()
            .distinct()
            .map(jobStore::get)
            .flatMap(Optional::stream)
            .filter(DownloadService::isDownloadable)
            .toList();

    LOGGER.info("Archive requested: ids={}, eligible={}", jobIds.size(), eligible.size());
    if (eligible.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new ArchivePlan(ARCHIVE_NAME, eligible));
  }

  /**
   * Stream the planned archive. {@code out} is left open.
   *
   * @return number of entries written
   */
  public int write(ArchivePlan plan, OutputStream out) throws IOException {
    ZipOutputStream zip = new ZipOutputStream(out);
    zip.setLevel(Deflater.BEST_COMPRESSION);
    Set<String> usedNames = new HashSet<>();
    int written = 0;

    for (ConversionJob job : plan.jobs()) {
      InputStream content;
      try {
        content = artifactStorage.openRead(job.artifactKey());
      } catch (ArtifactNotFoundException e) {
        LOGGER.warn("Skipping job {} in archive, artifact is gone", job.id());
        continue;
      }
      try (InputStream in = content) {
        zip.putNextEntry(new ZipEntry(uniqueName(DownloadService.fileNameOf(job), usedNames)));
        in.transferTo(zip);
        zip.closeEntry();
        written++;
      }
    }

    zip.finish();
    zip.flush();
    LOGGER.info("Archive written: entries={}", written);
    return written;
  }

  static String uniqueName(String name, Set<String> usedNames) {
    if (usedNames.add(name)) {
      return name;
    }
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    String extension = dot > 0 ? name.substring(dot) : "";
    for (int i = 1; ; i++) {
      String candidate = base + " (" + i + ")" + extension;
      if (usedNames.add(candidate)) {
        return candidate;
      }
    }
  }
}
