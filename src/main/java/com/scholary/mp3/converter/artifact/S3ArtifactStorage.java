package com.scholary.mp3.converter.artifact;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ArtifactStorage.
 *
 * <p>Uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * SDK retries transient failures (network issues, 500s, throttling) on its own; 404 and 403 fail
 * fast.
 *
 * <p>S3 needs the content length up front, so {@link #openWrite} spools to a local temp file and
 * uploads when the stream is closed.
 */
public class S3ArtifactStorage implements ArtifactStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactStorage.class);
  private static final String CONTENT_TYPE = "audio/mpeg";

  private final S3Client s3Client;
  private final String bucket;
  private final Path spoolDir;

  public S3ArtifactStorage(ObjectStoreProperties properties, Path spoolDir) {
    this(buildClient(properties), properties.bucket(), spoolDir);
  }

  S3ArtifactStorage(S3Client s3Client, String bucket, Path spoolDir) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.spoolDir = spoolDir;
    try {
      Files.createDirectories(spoolDir);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to create spool directory: " + spoolDir, e);
    }
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    return S3Client.builder()
        .region(properties.signingRegion())
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public OutputStream openWrite(String key) {
    try {
      Path spool = Files.createTempFile(spoolDir, "upload-", ".part");
      return new UploadOnClose(Files.newOutputStream(spool), spool, key);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to open spool file for key: " + key, e);
    }
  }

  @Override
  public InputStream openRead(String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);
    try {
      return s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (NoSuchKeyException e) {
      throw new ArtifactNotFoundException(key, e);
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStorageException(message, e);
    }
  }

  @Override
  public long size(String key) {
    return head(key).contentLength();
  }

  @Override
  public boolean exists(String key) {
    try {
      head(key);
      return true;
    } catch (ArtifactNotFoundException e) {
      return false;
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>S3 deletes succeed whether or not the key exists, so the object is looked up first. A
   * concurrent delete between the lookup and the delete still reports true.
   */
  @Override
  public boolean remove(String key) {
    if (!exists(key)) {
      LOGGER.debug("Remove skipped, no such object: bucket={}, key={}", bucket, key);
      return false;
    }
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Removed object: bucket={}, key={}", bucket, key);
      return true;
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to remove object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      throw new ArtifactStorageException(message, e);
    }
  }

  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }

  private HeadObjectResponse head(String key) {
    try {
      return s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (NoSuchKeyException e) {
      throw new ArtifactNotFoundException(key, e);
    } catch (S3Exception e) {
      // HEAD responses carry no body, so a missing key surfaces as a bare 404
      if (e.statusCode() == 404) {
        throw new ArtifactNotFoundException(key, e);
      }
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      throw new ArtifactStorageException(message, e);
    }
  }

  private void upload(Path spool, String key) {
    try {
      long length = Files.size(spool);
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(CONTENT_TYPE)
              .contentLength(length)
              .build();
      s3Client.putObject(request, RequestBody.fromFile(spool));
      LOGGER.info("Uploaded object: bucket={}, key={}, size={}", bucket, key, length);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to read spool file for key: " + key, e);
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStorageException(message, e);
    }
  }

  private final class UploadOnClose extends FilterOutputStream {

    private final Path spool;
    private final String key;
    private boolean closed;

    UploadOnClose(OutputStream out, Path spool, String key) {
      super(out);
      this.spool = spool;
      this.key = key;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
    }

    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      try {
        super.close();
        upload(spool, key);
      } catch (ArtifactStorageException e) {
        throw new IOException(e.getMessage(), e);
      } finally {
        Files.deleteIfExists(spool);
      }
    }
  }
}
