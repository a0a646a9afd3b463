package com.scholary.mp3.converter.api;

import com.scholary.mp3.converter.archive.ArchiveAssembler;
import com.scholary.mp3.converter.archive.ArchivePlan;
import com.scholary.mp3.converter.archive.ArtifactDownload;
import com.scholary.mp3.converter.archive.DownloadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST API for downloading converted MP3s, one at a time or as a ZIP archive.
 */
@RestController
@RequestMapping("/api/download")
@Tag(name = "Downloads", description = "Download converted MP3 files")
public class DownloadController {

  private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");
  private static final MediaType ZIP = MediaType.parseMediaType("application/zip");

  private final DownloadService downloadService;
  private final ArchiveAssembler archiveAssembler;

  public DownloadController(DownloadService downloadService, ArchiveAssembler archiveAssembler) {
    this.downloadService = downloadService;
    this.archiveAssembler = archiveAssembler;
  }

  @GetMapping("/{id}")
  @Operation(summary = "Download MP3", description = "Download the MP3 of a completed conversion")
  public ResponseEntity<?> download(@PathVariable long id) {
    Optional<ArtifactDownload> download = downloadService.open(id);
    if (download.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new MessageResponse("File not found or conversion not completed"));
    }
    ArtifactDownload artifact = download.get();
    Resource body = new InputStreamResource(artifact.content());
    ResponseEntity.BodyBuilder response =
        ResponseEntity.ok()
            .contentType(AUDIO_MPEG)
            .header(HttpHeaders.CONTENT_DISPOSITION, attachment(artifact.fileName()));
    if (artifact.size() != null) {
      response.contentLength(artifact.size());
    }
    return response.body(body);
  }

  @PostMapping("/bulk")
  @Operation(
      summary = "Download several MP3s",
      description = "Stream the MP3s of the given completed conversions as one ZIP archive")
  public ResponseEntity<?> downloadBulk(@RequestBody BulkDownloadRequest request) {
    if (request.ids() == null || request.ids().isEmpty()) {
      return ResponseEntity.badRequest().body(new MessageResponse("Invalid file IDs"));
    }
    Optional<ArchivePlan> plan = archiveAssembler.plan(request.ids());
    if (plan.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new MessageResponse("No valid files found for download"));
    }
    StreamingResponseBody body = out -> archiveAssembler.write(plan.get(), out);
    return ResponseEntity.ok()
        .contentType(ZIP)
        .header(HttpHeaders.CONTENT_DISPOSITION, attachment(plan.get().archiveName()))
        .body(body);
  }

  private static String attachment(String fileName) {
    return ContentDisposition.attachment()
        .filename(fileName, StandardCharsets.UTF_8)
        .build()
        .toString();
  }
}
