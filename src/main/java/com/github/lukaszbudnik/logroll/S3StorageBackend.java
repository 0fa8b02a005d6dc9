package com.github.lukaszbudnik.logroll;

import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.StorageClass;

/**
 * Archives rotated files to an S3 bucket.
 *
 * <p>Objects are keyed by the UTC upload date, {@code {prefix}{yyyy}/{MM}/{dd}/{filename}}, carry
 * the content hash, upload timestamp and source host as user metadata and are stored with the
 * infrequent-access storage class.
 */
public class S3StorageBackend implements StorageBackend {
  private static final Logger logger = LoggerFactory.getLogger(S3StorageBackend.class);

  static final String DEFAULT_REGION = "us-east-1";
  static final String METADATA_FILE_HASH = "file_hash";
  static final String METADATA_UPLOAD_TIMESTAMP = "upload_timestamp";
  static final String METADATA_SOURCE_INSTANCE = "source_instance";

  private static final DateTimeFormatter KEY_DATE =
      DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);

  private final S3Client client;
  private final String bucket;
  private final String prefix;
  private final Clock clock;
  private final String sourceInstance;

  public S3StorageBackend(
      S3Client client, String bucket, String prefix, Clock clock, String sourceInstance) {
    this.client = Objects.requireNonNull(client, "client");
    this.bucket = Objects.requireNonNull(bucket, "bucket");
    this.prefix = prefix != null ? prefix : "";
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sourceInstance = Objects.requireNonNull(sourceInstance, "sourceInstance");
  }

  /**
   * Build a backend from its configuration: {@code bucket} (required), {@code prefix}, {@code
   * region}, {@code access_key} and {@code secret_key}. Without explicit keys the SDK's default
   * credentials chain is used.
   *
   * @throws ConfigurationException if the bucket is missing or the client cannot be created
   */
  public static S3StorageBackend fromConfig(BackendConfig config) throws ConfigurationException {
    String bucket = config.getRequiredOption("bucket");
    String region = config.getOption("region", DEFAULT_REGION);
    String accessKey = config.getOption("access_key");
    String secretKey = config.getOption("secret_key");

    AwsCredentialsProvider credentials =
        accessKey != null && secretKey != null
            ? StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey))
            : DefaultCredentialsProvider.create();
    S3Client client;
    try {
      client = S3Client.builder().region(Region.of(region)).credentialsProvider(credentials).build();
    } catch (SdkException e) {
      throw new ConfigurationException("Failed to create S3 client for bucket " + bucket, e);
    }
    logger.info("S3 storage backend initialized: bucket={}, region={}", bucket, region);
    return new S3StorageBackend(
        client, bucket, config.getOption("prefix", ""), Clock.systemUTC(), localHostName());
  }

  @Override
  public boolean upload(Path file, String contentHash) {
    Instant now = clock.instant();
    String key = objectKey(file, now);

    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(METADATA_FILE_HASH, contentHash);
    metadata.put(METADATA_UPLOAD_TIMESTAMP, now.toString());
    metadata.put(METADATA_SOURCE_INSTANCE, sourceInstance);

    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .metadata(metadata)
            .storageClass(StorageClass.STANDARD_IA)
            .build();
    try {
      client.putObject(request, RequestBody.fromFile(file));
      logger.debug("Uploaded {} to s3://{}/{}", file, bucket, key);
      return true;
    } catch (SdkException | UncheckedIOException e) {
      logger.error("Failed to upload {} to S3 bucket {}: {}", file, bucket, e.getMessage(), e);
      return false;
    }
  }

  String objectKey(Path file, Instant uploadTime) {
    return prefix + KEY_DATE.format(uploadTime) + "/" + file.getFileName();
  }

  private static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.warn("Could not resolve local host name, using 'unknown': {}", e.getMessage());
      return "unknown";
    }
  }
}
