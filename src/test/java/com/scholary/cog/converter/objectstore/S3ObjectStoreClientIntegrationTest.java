package com.scholary.cog.converter.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/**
 * Integration test against a real MinIO server.
 *
 * <p>Uses Testcontainers; skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientIntegrationTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "cog";
  private static final String ARCHIVE_BUCKET = "envicloud";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:RELEASE.2024-05-10T01-41-38Z")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient client;

  @TempDir Path tempDir;

  @BeforeAll
  static void setUp() {
    String endpoint =
        String.format("http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));

    try (S3Client admin =
        S3Client.builder()
            .endpointOverride(java.net.URI.create(endpoint))
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .forcePathStyle(true)
            .build()) {
      admin.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
      admin.createBucket(CreateBucketRequest.builder().bucket(ARCHIVE_BUCKET).build());
    }

    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true, 30, 2),
            new ObjectMapper());
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void uploadDownloadAndExists_shouldRoundTripFile() throws Exception {
    Path source = Files.write(tempDir.resolve("in.tif"), new byte[] {0x49, 0x49, 0x2A, 0x00});

    assertThat(client.exists(BUCKET, "rt/in.tif")).isFalse();
    client.uploadFile(BUCKET, "rt/in.tif", source, "image/tiff");

    assertThat(client.exists(BUCKET, "rt/in.tif")).isTrue();
    assertThat(client.getObjectMetadata(BUCKET, "rt/in.tif").contentLength()).isEqualTo(4);

    Path target = tempDir.resolve("out.tif");
    client.downloadToFile(BUCKET, "rt/in.tif", target);
    assertThat(target).hasBinaryContent(new byte[] {0x49, 0x49, 0x2A, 0x00});
  }

  @Test
  void copyObject_shouldMakeCopyVisibleInOtherBucket() throws Exception {
    Path source = Files.write(tempDir.resolve("scene.tif"), new byte[] {1, 2, 3});
    client.uploadFile(ARCHIVE_BUCKET, "scenes/scene.tif", source, "image/tiff");

    client.copyObject(ARCHIVE_BUCKET, "scenes/scene.tif", BUCKET, "scenes/scene.tif");

    assertThat(client.exists(BUCKET, "scenes/scene.tif")).isTrue();
  }

  @Test
  void getObjectMetadata_shouldReportMissingObjectAsNotFound() {
    assertThatThrownBy(() -> client.getObjectMetadata(BUCKET, "nope.tif"))
        .isInstanceOf(ObjectNotFoundException.class);
  }

  @Test
  void presignGet_shouldServeRangeRequests() throws Exception {
    Path source = Files.write(tempDir.resolve("range.tif"), new byte[] {10, 11, 12, 13, 14});
    client.uploadFile(BUCKET, "range.tif", source, "image/tiff");

    URL url = client.presignGet(BUCKET, "range.tif", Duration.ofMinutes(5));
    HttpURLConnection connection = (HttpURLConnection) url.openConnection();
    connection.setRequestProperty("Range", "bytes=1-2");
    try (InputStream in = connection.getInputStream()) {
      assertThat(connection.getResponseCode()).isEqualTo(206);
      assertThat(in.readAllBytes()).containsExactly(11, 12);
    } finally {
      connection.disconnect();
    }
  }

  @Test
  void setPublicReadPolicy_shouldAllowAnonymousReads() throws Exception {
    Path source = Files.write(tempDir.resolve("public.tif"), new byte[] {7});
    client.uploadFile(BUCKET, "public.tif", source, "image/tiff");

    client.setPublicReadPolicy(BUCKET);

    URL url =
        new URL(
            String.format(
                "http://%s:%d/%s/public.tif",
                minioContainer.getHost(), minioContainer.getMappedPort(9000), BUCKET));
    HttpURLConnection connection = (HttpURLConnection) url.openConnection();
    try {
      assertThat(connection.getResponseCode()).isEqualTo(200);
    } finally {
      connection.disconnect();
    }
  }
}
