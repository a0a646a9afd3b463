package com.scholary.mp3.converter.api;

import com.scholary.mp3.converter.artifact.ArtifactLifecycle;
import com.scholary.mp3.converter.job.JobStatus;
import com.scholary.mp3.converter.job.JobStore;
import com.scholary.mp3.converter.submission.ConversionSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for conversion jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting one URL or a batch of up to ten
 *   <li>Listing and polling jobs
 *   <li>Deleting a job together with its MP3
 * </ul>
 *
 * <p>Conversions are asynchronous: submission returns the PENDING job immediately and clients
 * poll for progress.
 */
@RestController
@RequestMapping("/api/conversions")
@Tag(name = "Conversions", description = "Video to MP3 conversion jobs")
public class ConversionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionController.class);

  private final ConversionSubmissionService submissionService;
  private final JobStore jobStore;
  private final ArtifactLifecycle artifactLifecycle;

  public ConversionController(
      ConversionSubmissionService submissionService,
      JobStore jobStore,
      ArtifactLifecycle artifactLifecycle) {
    this.submissionService = submissionService;
    this.jobStore = jobStore;
    this.artifactLifecycle = artifactLifecycle;
  }

  @GetMapping
  @Operation(
      summary = "List conversions",
      description = "All conversions, most recent first, optionally filtered by status")
  public List<ConversionResponse> list(@RequestParam(required = false) String status) {
    var jobs =
        status == null ? jobStore.list() : jobStore.listByStatus(JobStatus.fromWireName(status));
    return jobs.stream().map(ConversionResponse::from).toList();
  }

  @PostMapping
  @Operation(summary = "Convert a video", description = "Start converting one video URL to MP3")
  public ConversionResponse create(@Valid @RequestBody CreateConversionRequest request) {
    LOGGER.info("Conversion request: url={}", request.url());
    return ConversionResponse.from(submissionService.submit(request.url()));
  }

  @PostMapping("/bulk")
  @Operation(
      summary = "Convert several videos",
      description = "Start converting up to ten video URLs; an invalid URL rejects the batch")
  public List<ConversionResponse> createBulk(@Valid @RequestBody BulkConversionRequest request) {
    LOGGER.info("Bulk conversion request: urls={}", request.urls().size());
    return submissionService.submitBatch(request.urls()).stream()
        .map(ConversionResponse::from)
        .toList();
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get conversion", description = "Current state and progress of a job")
  public ResponseEntity<ConversionResponse> get(@PathVariable long id) {
    return jobStore
        .get(id)
        .map(job -> ResponseEntity.ok(ConversionResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete conversion", description = "Remove a job and its MP3 file")
  public ResponseEntity<MessageResponse> delete(@PathVariable long id) {
    if (!artifactLifecycle.delete(id)) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new MessageResponse("Conversion not found"));
    }
    return ResponseEntity.ok(new MessageResponse("Conversion deleted successfully"));
  }
}
