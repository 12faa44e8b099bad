package io.backup4j.adapter.destination;

import io.backup4j.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.UploadPartCopyRequest;
import software.amazon.awssdk.services.s3.model.UploadPartCopyResponse;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * S3-compatible object storage. URL {@code s3://bucket[/prefix]}; login and password are the
 * access key pair, the api key (when present) overrides the endpoint for MinIO-style servers.
 *
 * <p>S3 has no rename, so commit is copy-then-delete of the provisional object; readers never
 * see the final key before the copy completed. Objects above the single-request copy limit are
 * copied part by part through a multipart upload.
 */
public class S3BackupDestination extends AbstractBackupDestination {
    private static final Logger log = LoggerFactory.getLogger(S3BackupDestination.class);

    static final Region DEFAULT_REGION = Region.US_EAST_1;
    // CopyObject rejects sources larger than 5 GiB.
    static final long MAX_SINGLE_COPY_BYTES = 5L * 1024 * 1024 * 1024;
    static final long COPY_PART_BYTES = 512L * 1024 * 1024;

    private final S3Client s3;
    private final String bucket;
    private final String prefix;
    private final long multipartThreshold;
    private final long partSize;

    public S3BackupDestination(Credentials credentials) {
        this(buildClient(credentials), credentials.url());
    }

    S3BackupDestination(S3Client s3, String url) {
        this(s3, url, MAX_SINGLE_COPY_BYTES, COPY_PART_BYTES);
    }

    S3BackupDestination(S3Client s3, String url, long multipartThreshold, long partSize) {
        URI uri = URI.create(url);
        if (!"s3".equals(uri.getScheme()) || uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("s3 url must look like s3://bucket/prefix");
        }
        this.s3 = s3;
        this.bucket = uri.getHost();
        String path = uri.getPath() == null ? "" : uri.getPath().replaceAll("^/+|/+$", "");
        this.prefix = path.isEmpty() ? "" : path + "/";
        this.multipartThreshold = multipartThreshold;
        this.partSize = partSize;
    }

    private static S3Client buildClient(Credentials credentials) {
        S3ClientBuilder builder = S3Client.builder()
                .httpClientBuilder(ApacheHttpClient.builder())
                .region(DEFAULT_REGION);
        if (credentials.hasLogin()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(credentials.login(), credentials.password())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }
        if (credentials.hasApiKey()) {
            builder.endpointOverride(URI.create(credentials.apiKey()))
                    .forcePathStyle(true);
        }
        return builder.build();
    }

    @Override
    protected void put(Path local, String name) throws IOException {
        try {
            s3.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(prefix + name)
                            .contentLength(Files.size(local))
                            .build(),
                    RequestBody.fromFile(local));
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    protected void rename(String fromName, String toName) throws IOException {
        String from = prefix + fromName;
        String to = prefix + toName;
        try {
            long size = s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(from).build()).contentLength();
            if (size > multipartThreshold) {
                multipartCopy(from, to, size);
            } else {
                s3.copyObject(CopyObjectRequest.builder()
                        .sourceBucket(bucket)
                        .sourceKey(from)
                        .destinationBucket(bucket)
                        .destinationKey(to)
                        .build());
            }
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(from).build());
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private void multipartCopy(String from, String to, long size) {
        String uploadId = s3.createMultipartUpload(CreateMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(to)
                .build()).uploadId();
        log.info("Multipart copy started destination={} key={} size={} uploadId={}", describe(), to, size, uploadId);
        try {
            List<CompletedPart> parts = new ArrayList<>();
            int partNumber = 1;
            for (long start = 0; start < size; start += partSize, partNumber++) {
                long end = Math.min(start + partSize, size) - 1;
                UploadPartCopyResponse response = s3.uploadPartCopy(UploadPartCopyRequest.builder()
                        .sourceBucket(bucket)
                        .sourceKey(from)
                        .destinationBucket(bucket)
                        .destinationKey(to)
                        .uploadId(uploadId)
                        .partNumber(partNumber)
                        .copySourceRange("bytes=" + start + "-" + end)
                        .build());
                parts.add(CompletedPart.builder()
                        .partNumber(partNumber)
                        .eTag(response.copyPartResult().eTag())
                        .build());
            }
            s3.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(to)
                    .uploadId(uploadId)
                    .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                    .build());
        } catch (SdkException e) {
            try {
                s3.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                        .bucket(bucket)
                        .key(to)
                        .uploadId(uploadId)
                        .build());
            } catch (SdkException abort) {
                e.addSuppressed(abort);
            }
            throw e;
        }
    }

    @Override
    protected void remove(String key) throws IOException {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    protected List<StoredObject> list() throws IOException {
        List<StoredObject> out = new ArrayList<>();
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .delimiter("/")
                    .build();
            for (S3Object o : s3.listObjectsV2Paginator(request).contents()) {
                if (o.key().endsWith("/")) {
                    continue;
                }
                String name = o.key().substring(prefix.length());
                out.add(new StoredObject(name, o.key(), o.size(), o.lastModified()));
            }
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
        return out;
    }

    @Override
    protected void fetch(String key, Path target) throws IOException {
        try {
            Files.deleteIfExists(target);
            s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build(),
                    ResponseTransformer.toFile(target));
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    protected String keyOf(String name) {
        return prefix + name;
    }

    @Override
    protected String describe() {
        return "s3://" + bucket + "/" + prefix;
    }

    @Override
    public boolean testConnection() {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return true;
        } catch (SdkException e) {
            log.warn("Connection test failed destination={} msg={}", describe(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        s3.close();
    }
}
