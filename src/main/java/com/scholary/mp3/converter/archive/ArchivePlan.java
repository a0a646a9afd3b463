package com.scholary.mp3.converter.archive;

import com.scholary.mp3.converter.job.ConversionJob;
import java.util.List;

/**
 * The completed jobs selected for a bulk archive, in request order.
 *
 * @param archiveName suggested download name for the archive
 * @param jobs jobs whose artifacts become archive entries
 */
public record ArchivePlan(String archiveName, List<ConversionJob> jobs) {

  public ArchivePlan {
    jobs = List.copyOf(jobs);
  }
}
