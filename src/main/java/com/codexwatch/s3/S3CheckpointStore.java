package com.codexwatch.s3;

import com.codexwatch.config.AppConfig;
import com.codexwatch.error.PersistenceException;
import com.codexwatch.model.Checkpoint;
import com.codexwatch.model.CheckpointStore;
import com.codexwatch.store.CheckpointCodec;
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
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.net.URI;
import java.util.Objects;

/**
 * S3-backed checkpoint store.
 *
 * <p>The whole record is one object; a single PutObject replaces it, so
 * readers see either the previous or the new record.
 */
public final class S3CheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(S3CheckpointStore.class);

    private final S3Client s3Client;
    private final CheckpointCodec codec;
    private final String bucket;
    private final String key;

    public S3CheckpointStore(AppConfig config) {
        this(buildClient(config),
                Objects.requireNonNull(config.s3CheckpointBucketName(), "s3CheckpointBucketName must not be null"),
                config.s3CheckpointKey());
    }

    public S3CheckpointStore(S3Client s3Client, String bucket, String key) {
        this.s3Client = s3Client;
        this.codec = new CheckpointCodec();
        this.bucket = bucket;
        this.key = key;
    }

    @Override
    public Checkpoint load() {
        byte[] payload;
        try {
            payload = s3Client.getObjectAsBytes(
                    GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .build()
            ).asByteArray();

        } catch (NoSuchKeyException e) {
            log.info("No checkpoint at s3://{}/{}, starting from an empty one", bucket, key);
            return Checkpoint.empty();

        } catch (SdkException e) {
            throw new PersistenceException(
                    "Failed to load checkpoint from s3://" + bucket + "/" + key,
                    e
            );
        }
        return codec.decode(payload, "s3://" + bucket + "/" + key);
    }

    @Override
    public void save(Checkpoint checkpoint) {
        byte[] payload = codec.encode(checkpoint);
        try {
            s3Client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType("application/json")
                            .build(),
                    RequestBody.fromBytes(payload)
            );
            log.debug("Checkpoint saved to s3://{}/{}", bucket, key);

        } catch (SdkException e) {
            throw new PersistenceException(
                    "Failed to save checkpoint to s3://" + bucket + "/" + key,
                    e
            );
        }
    }

    private static S3Client buildClient(AppConfig config) {
        Region region = Region.of(config.awsRegion());
        S3ClientBuilder builder = S3Client.builder().region(region);

        AwsCredentialsProvider credentials;
        if (config.useLocalstack()) {
            credentials = StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test"));
        } else {
            credentials = DefaultCredentialsProvider.create();
        }

        if (config.s3Endpoint() != null && !config.s3Endpoint().isEmpty()) {
            builder = builder
                    .endpointOverride(URI.create(config.s3Endpoint()))
                    .serviceConfiguration(S3Configuration.builder()
                            .pathStyleAccessEnabled(true)
                            .build());
        }

        return builder.credentialsProvider(credentials).build();
    }
}
