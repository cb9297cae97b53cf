package com.meteoharvest.service.store;

import com.amazonaws.AmazonClientException;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.meteoharvest.ingest.api.BlobStore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * S3-compatible blob store. Without a configured bucket the container is the bucket and the path is
 * the key; with one, objects land under {@code bucket/container/path}.
 */
public class S3BlobStore implements BlobStore {
    private static final String DEFAULT_REGION = "us-east-1";

    private final AmazonS3 s3Client;
    private final String bucket;

    public S3BlobStore(AmazonS3 s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket == null || bucket.isBlank() ? null : bucket;
    }

    /**
     * Builds a client from the default credential chain. A custom endpoint switches to path-style
     * access for MinIO-like gateways.
     */
    public static S3BlobStore create(String endpoint, String region, String bucket) {
        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
                .withCredentials(new DefaultAWSCredentialsProviderChain());
        String effectiveRegion = region == null || region.isBlank() ? DEFAULT_REGION : region;
        if (endpoint != null && !endpoint.isBlank()) {
            builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, effectiveRegion));
            builder.withPathStyleAccessEnabled(true);
        } else {
            builder.withRegion(effectiveRegion);
        }
        return new S3BlobStore(builder.build(), bucket);
    }

    @Override
    public void upload(String container, String path, byte[] payload) throws IOException {
        String targetBucket = bucket == null ? container : bucket;
        String key = bucket == null ? path : container + "/" + path;

        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentLength(payload.length);
        metadata.setContentType(contentType(path));
        try (InputStream input = new ByteArrayInputStream(payload)) {
            s3Client.putObject(new PutObjectRequest(targetBucket, key, input, metadata));
        } catch (AmazonClientException e) {
            throw new IOException("Failed to write s3://" + targetBucket + "/" + key, e);
        }
    }

    static String contentType(String path) {
        if (path.endsWith(".csv")) {
            return "text/csv; charset=utf-8";
        }
        if (path.endsWith(".json")) {
            return "application/json";
        }
        return "application/octet-stream";
    }
}
