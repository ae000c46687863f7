package com.scholary.cog.converter.objectstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.internal.waiters.ResponseOrException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.waiters.WaiterResponse;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>Retry logic: the SDK retries transient failures (network issues, 5xx, throttling) up to
 * {@code objectstore.maxRetries} times, and every API call is bounded by {@code
 * objectstore.apiCallTimeoutSeconds}. 404 and 403 are not retried and are translated into {@link
 * ObjectNotFoundException} and {@link ObjectAccessDeniedException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final ObjectMapper objectMapper;

  public S3ObjectStoreClient(ObjectStoreProperties properties, ObjectMapper objectMapper) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}, maxRetries={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess(),
        properties.maxRetries());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());
    StaticCredentialsProvider credentialsProvider = StaticCredentialsProvider.create(credentials);

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    ClientOverrideConfiguration overrideConfiguration =
        ClientOverrideConfiguration.builder()
            .apiCallTimeout(Duration.ofSeconds(properties.apiCallTimeoutSeconds()))
            .retryPolicy(RetryPolicy.builder().numRetries(properties.maxRetries()).build())
            .build();

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
            .overrideConfiguration(overrideConfiguration)
            .build();

    // Presigned URLs must use the same addressing style, otherwise MinIO rejects them
    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build())
            .build();
    this.objectMapper = objectMapper;

    LOGGER.info("S3 client initialized successfully");
  }

  S3ObjectStoreClient(S3Client s3Client, S3Presigner s3Presigner, ObjectMapper objectMapper) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean exists(String bucket, String key) {
    LOGGER.debug("Checking existence: bucket={}, key={}", bucket, key);
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      throw translate("check existence of", bucket, key, e);
    } catch (Exception e) {
      throw translate("check existence of", bucket, key, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, key);

    try {
      HeadObjectResponse response =
          s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());

      LOGGER.info(
          "Retrieved metadata: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          key,
          response.contentLength(),
          response.contentType());

      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (Exception e) {
      throw translate("get metadata of", bucket, key, e);
    }
  }

  @Override
  public void copyObject(
      String sourceBucket, String sourceKey, String destinationBucket, String destinationKey) {
    LOGGER.info(
        "Copying object: {}/{} -> {}/{}",
        sourceBucket,
        sourceKey,
        destinationBucket,
        destinationKey);

    try {
      s3Client.copyObject(
          CopyObjectRequest.builder()
              .sourceBucket(sourceBucket)
              .sourceKey(sourceKey)
              .destinationBucket(destinationBucket)
              .destinationKey(destinationKey)
              .build());
    } catch (Exception e) {
      throw translate("copy", sourceBucket, sourceKey, e);
    }

    // Later steps read from the destination, so the copy has to be visible first
    try {
      WaiterResponse<HeadObjectResponse> waiterResponse =
          s3Client
              .waiter()
              .waitUntilObjectExists(
                  HeadObjectRequest.builder()
                      .bucket(destinationBucket)
                      .key(destinationKey)
                      .build());
      ResponseOrException<HeadObjectResponse> matched = waiterResponse.matched();
      if (matched.response().isEmpty()) {
        throw new ObjectStoreException(
            String.format(
                "Copied object never became visible: bucket=%s, key=%s",
                destinationBucket, destinationKey),
            matched.exception().orElse(null));
      }
    } catch (ObjectStoreException e) {
      throw e;
    } catch (Exception e) {
      throw translate("wait for copy of", destinationBucket, destinationKey, e);
    }

    LOGGER.info("Copy visible: bucket={}, key={}", destinationBucket, destinationKey);
  }

  @Override
  public void downloadToFile(String bucket, String key, Path target) {
    LOGGER.debug("Downloading object: bucket={}, key={}, target={}", bucket, key, target);

    GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
    try (ResponseInputStream<GetObjectResponse> stream = s3Client.getObject(request)) {
      long bytes = Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.info("Downloaded object: bucket={}, key={}, bytes={}", bucket, key, bytes);
    } catch (IOException e) {
      String message =
          String.format("Failed to write object to %s: bucket=%s, key=%s", target, bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    } catch (Exception e) {
      throw translate("download", bucket, key, e);
    }
  }

  @Override
  public void uploadFile(String bucket, String key, Path source, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, source={}, contentType={}",
        bucket,
        key,
        source,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();

      s3Client.putObject(request, RequestBody.fromFile(source));

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);

    } catch (Exception e) {
      throw translate("upload", bucket, key, e);
    }
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    LOGGER.debug("Generating presigned URL: bucket={}, key={}, ttl={}", bucket, key, ttl);

    try {
      GetObjectRequest getObjectRequest =
          GetObjectRequest.builder().bucket(bucket).key(key).build();

      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .getObjectRequest(getObjectRequest)
              .build();

      PresignedGetObjectRequest presignedRequest = s3Presigner.presignGetObject(presignRequest);
      return presignedRequest.url();

    } catch (Exception e) {
      throw translate("presign", bucket, key, e);
    }
  }

  @Override
  public void setPublicReadPolicy(String bucket) {
    LOGGER.info("Applying public read policy: bucket={}", bucket);

    try {
      s3Client.putBucketPolicy(
          PutBucketPolicyRequest.builder().bucket(bucket).policy(publicReadPolicy(bucket)).build());
    } catch (Exception e) {
      throw translate("set public read policy on", bucket, "*", e);
    }
  }

  String publicReadPolicy(String bucket) {
    ObjectNode policy = objectMapper.createObjectNode();
    policy.put("Version", "2012-10-17");
    ArrayNode statements = policy.putArray("Statement");
    ObjectNode statement = statements.addObject();
    statement.put("Sid", "PublicRead");
    statement.put("Effect", "Allow");
    statement.putObject("Principal").putArray("AWS").add("*");
    statement.putArray("Action").add("s3:GetObject");
    statement.putArray("Resource").add("arn:aws:s3:::" + bucket + "/*");
    try {
      return objectMapper.writeValueAsString(policy);
    } catch (JsonProcessingException e) {
      throw new ObjectStoreException("Failed to serialize bucket policy for " + bucket, e);
    }
  }

  /**
   * Map SDK failures onto the store's exception hierarchy.
   *
   * <p>404 means the object (or bucket) is missing, 403 means the credentials may not touch it.
   * Anything else is a storage I/O failure.
   */
  private ObjectStoreException translate(String action, String bucket, String key, Exception e) {
    if (e instanceof NoSuchKeyException || e instanceof NoSuchBucketException) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      return new ObjectNotFoundException(message, e);
    }
    if (e instanceof S3Exception) {
      S3Exception s3Exception = (S3Exception) e;
      if (s3Exception.statusCode() == 404) {
        String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
        LOGGER.error(message);
        return new ObjectNotFoundException(message, e);
      }
      if (s3Exception.statusCode() == 403) {
        String message =
            String.format(
                "Access denied while trying to %s: bucket=%s, key=%s", action, bucket, key);
        LOGGER.error(message);
        return new ObjectAccessDeniedException(message, e);
      }
      String message =
          String.format(
              "Failed to %s object: bucket=%s, key=%s, statusCode=%s",
              action, bucket, key, s3Exception.statusCode());
      LOGGER.error(message, e);
      return new ObjectStoreException(message, e);
    }
    String message =
        String.format(
            "Unexpected error trying to %s object: bucket=%s, key=%s", action, bucket, key);
    LOGGER.error(message, e);
    return new ObjectStoreException(message, e);
  }

  /**
   * Clean up resources when the client is no longer needed.
   *
   * <p>Registered as the bean's destroy method so connections and threads are released on
   * shutdown.
   */
  public void close() {
    LOGGER.info("Closing S3 client and presigner");
    s3Client.close();
    s3Presigner.close();
  }
}
