package com.scholary.mp3.converter.artifact;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import software.amazon.awssdk.regions.Region;

/**
 * Connection settings for keeping MP3 artifacts in an S3-compatible bucket ("objectstore.*").
 *
 * <p>Bound only when {@code artifacts.backend=s3}. Set {@code pathStyleAccess} for MinIO and other
 * endpoints without virtual-host bucket addressing.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {

  /** The configured signing region, us-east-1 when none is set. */
  public Region signingRegion() {
    return region == null || region.isBlank() ? Region.US_EAST_1 : Region.of(region);
  }
}
