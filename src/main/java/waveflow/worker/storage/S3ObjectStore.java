package waveflow.worker.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import waveflow.worker.config.WorkerConfig;
import waveflow.worker.util.Json;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link ObjectStore} backed by an S3 bucket (AWS SDK v2, synchronous client).
 */
public class S3ObjectStore implements ObjectStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3Client;
    private final String bucket;

    public S3ObjectStore(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    /**
     * Build a client for the configured region; an endpoint override switches to
     * path-style addressing for local emulators.
     */
    public static S3ObjectStore create(WorkerConfig config) {
        S3ClientBuilder builder = S3Client.builder().region(Region.of(config.region()));
        if (config.endpointOverride() != null) {
            builder.endpointOverride(URI.create(config.endpointOverride())).forcePathStyle(true);
        }
        return new S3ObjectStore(builder.build(), config.bucketName());
    }

    @Override
    public boolean download(String key, Path target) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try (ResponseInputStream<GetObjectResponse> in = s3Client.getObject(request)) {
            long bytes = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Downloaded s3://{}/{} ({} bytes)", bucket, key, bytes);
            return true;
        } catch (NoSuchKeyException e) {
            log.error("Object not found: s3://{}/{}", bucket, key);
            return false;
        } catch (SdkException | IOException e) {
            log.error("Download failed for s3://{}/{}: {}", bucket, key, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean upload(Path source, String key) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentTypeFor(key))
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(source));
            log.info("Uploaded {} to s3://{}/{}", source.getFileName(), bucket, key);
            return true;
        } catch (SdkException e) {
            log.error("Upload failed for s3://{}/{}: {}", bucket, key, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean delete(String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            s3Client.deleteObject(request);
            log.info("Deleted s3://{}/{}", bucket, key);
            return true;
        } catch (SdkException e) {
            log.error("Delete failed for s3://{}/{}: {}", bucket, key, e.getMessage());
            return false;
        }
    }

    @Override
    public String uploadJson(Object value, String key) {
        byte[] body;
        try {
            body = Json.mapper().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize JSON for s3://{}/{}: {}", bucket, key, e.getMessage());
            return null;
        }

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("application/json")
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(body));
            String url = s3Client.utilities().getUrl(b -> b.bucket(bucket).key(key)).toExternalForm();
            log.info("Uploaded JSON to {} ({} bytes)", url, body.length);
            return url;
        } catch (SdkException e) {
            log.error("JSON upload failed for s3://{}/{}: {}", bucket, key, e.getMessage());
            return null;
        }
    }

    @Override
    public void probe() throws StorageUnavailableException {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (SdkException e) {
            throw new StorageUnavailableException("bucket " + bucket + " unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        s3Client.close();
    }

    private static String contentTypeFor(String key) {
        String lower = key.toLowerCase();
        if (lower.endsWith(".wav")) {
            return "audio/wav";
        }
        if (lower.endsWith(".json")) {
            return "application/json";
        }
        return "application/octet-stream";
    }
}
