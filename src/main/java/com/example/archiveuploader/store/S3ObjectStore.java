package com.example.archiveuploader.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.InputStream;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Hierarchical store over a flat S3 bucket. A directory {@code /a/b} is the
 * zero-byte marker object {@code a/b/}; objects may only be written below an
 * existing marker.
 */
public final class S3ObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStore.class);
    static final String DIRECTORY_CONTENT_TYPE = "application/x-directory";
    static final String COPIES_METADATA = "copies";

    private final S3Client s3Client;
    private final String bucket;

    public S3ObjectStore(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    public static S3ObjectStore create(String bucket, Optional<String> region, Optional<String> endpoint) {
        S3ClientBuilder builder = S3Client.builder();
        region.map(Region::of).ifPresent(builder::region);
        endpoint.map(URI::create).ifPresent(uri -> builder.endpointOverride(uri).forcePathStyle(true));
        return new S3ObjectStore(builder.build(), bucket);
    }

    @Override
    public void put(String path, InputStream body, PutOptions options) throws StoreException {
        String key = keyFor(path);
        if (key.isEmpty()) {
            throw new StoreException(StoreException.Kind.OTHER, path, "Cannot write an object at the bucket root");
        }
        String parentKey = keyFor(ObjectStore.parentOf(path));
        if (!parentKey.isEmpty() && !exists(path, parentKey + "/")) {
            if (exists(path, parentKey)) {
                throw new StoreException(StoreException.Kind.PARENT_NOT_DIRECTORY, path,
                        ObjectStore.parentOf(path) + " is not a directory");
            }
            throw new StoreException(StoreException.Kind.DIRECTORY_DOES_NOT_EXIST, path,
                    ObjectStore.parentOf(path) + " does not exist");
        }

        Map<String, String> metadata = new HashMap<>();
        options.headers().forEach((name, value) -> {
            if (!PutOptions.CONTENT_TYPE.equals(name)) {
                metadata.put(name, value);
            }
        });
        metadata.put(COPIES_METADATA, Integer.toString(options.copies()));
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentLength(options.size())
                .contentType(options.contentType())
                .metadata(metadata)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromInputStream(body, options.size()));
            LOGGER.debug("Uploaded {} to s3://{}/{}", path, bucket, key);
        } catch (SdkException ex) {
            throw new StoreException(StoreException.Kind.OTHER, path, "Failed to upload s3://" + bucket + "/" + key, ex);
        }
    }

    @Override
    public void mkdirp(String path) throws StoreException {
        String key = keyFor(path);
        if (key.isEmpty()) {
            return;
        }
        StringBuilder prefix = new StringBuilder();
        for (String segment : key.split("/")) {
            prefix.append(segment).append('/');
            if (exists(path, prefix.toString())) {
                continue;
            }
            if (exists(path, prefix.substring(0, prefix.length() - 1))) {
                throw new StoreException(StoreException.Kind.OTHER, path,
                        "/" + prefix.substring(0, prefix.length() - 1) + " exists and is not a directory");
            }
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(prefix.toString())
                    .contentType(DIRECTORY_CONTENT_TYPE)
                    .build();
            try {
                s3Client.putObject(request, RequestBody.empty());
                LOGGER.debug("Created directory marker s3://{}/{}", bucket, prefix);
            } catch (SdkException ex) {
                throw new StoreException(StoreException.Kind.OTHER, path, "Failed to create directory " + path, ex);
            }
        }
    }

    @Override
    public void close() {
        s3Client.close();
    }

    static String keyFor(String path) {
        return path.replaceAll("^/+", "").replaceAll("/+$", "");
    }

    private boolean exists(String path, String key) throws StoreException {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException ex) {
            return false;
        } catch (S3Exception ex) {
            if (ex.statusCode() == 404) {
                return false;
            }
            throw new StoreException(StoreException.Kind.OTHER, path, "Failed to look up s3://" + bucket + "/" + key, ex);
        } catch (SdkException ex) {
            throw new StoreException(StoreException.Kind.OTHER, path, "Failed to look up s3://" + bucket + "/" + key, ex);
        }
    }
}
