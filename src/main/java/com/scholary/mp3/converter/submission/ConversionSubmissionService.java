package com.scholary.mp3.converter.submission;

import com.scholary.mp3.converter.config.ConversionProperties;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.job.JobStore;
import com.scholary.mp3.converter.pipeline.ConversionDispatcher;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts single and bulk conversion requests.
 *
 * <p>Bulk submission is all-or-nothing: every URL is validated before the first job is created,
 * and one bad URL rejects the whole batch. Created jobs are returned in PENDING state right away;
 * their pipelines run in the background and are observed by polling.
 */
@Service
public class ConversionSubmissionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionSubmissionService.class);

  private final JobStore jobStore;
  private final ReferenceValidator validator;
  private final ConversionDispatcher dispatcher;
  private final int maxBatchSize;

  public ConversionSubmissionService(
      JobStore jobStore,
      ReferenceValidator validator,
      ConversionDispatcher dispatcher,
      ConversionProperties properties) {
    this.jobStore = jobStore;
    this.validator = validator;
    this.dispatcher = dispatcher;
    this.maxBatchSize = properties.maxBatchSize();
  }

  /**
   * Submit one URL.
   *
   * @throws InvalidSubmissionException if the URL is invalid
   */
  public ConversionJob submit(String url) {
    validator.validate(url);
    ConversionJob job = createAndLaunch(url.trim());
    LOGGER.info("Accepted conversion: jobId={}, url={}", job.id(), job.sourceUrl());
    return job;
  }

  /**
   * Submit a batch of URLs.
   *
   * @return the created jobs, in request order
   * @throws InvalidSubmissionException if the batch size is out of range or any URL is invalid;
   *     no job is created in that case
   */
  public List<ConversionJob> submitBatch(List<String> urls) {
    if (urls == null || urls.isEmpty()) {
      throw new InvalidSubmissionException("At least one URL is required");
    }
    if (urls.size() > maxBatchSize) {
      throw new InvalidSubmissionException(
          String.format("At most %d URLs per request, got %d", maxBatchSize, urls.size()));
    }
    urls.forEach(validator::validate);

    List<ConversionJob> jobs = new ArrayList<>(urls.size());
    for (String url : urls) {
      jobs.add(createAndLaunch(url.trim()));
    }
    LOGGER.info("Accepted bulk conversion: jobs={}", jobs.stream().map(ConversionJob::id).toList());
    return jobs;
  }

  private ConversionJob createAndLaunch(String url) {
    ConversionJob job = jobStore.create(url);
    dispatcher.launch(job);
    return job;
  }
}
