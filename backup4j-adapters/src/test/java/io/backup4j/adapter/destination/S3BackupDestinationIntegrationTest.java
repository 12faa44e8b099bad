package io.backup4j.adapter.destination;

import io.backup4j.BackupArtifact;
import io.backup4j.core.exception.AdapterTransportException;
import io.backup4j.utils.ArtifactNames;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.testcontainers.containers.localstack.LocalStackContainer.Service.S3;

@Testcontainers(disabledWithoutDocker = true)
class S3BackupDestinationIntegrationTest {

    @Container
    static final LocalStackContainer LOCAL_STACK =
            new LocalStackContainer(DockerImageName.parse("localstack/localstack:3.8")).withServices(S3);

    private static S3Client s3;

    @TempDir
    Path tmp;

    private String bucket;
    private S3BackupDestination destination;

    @BeforeAll
    static void client() {
        s3 = S3Client.builder()
                .endpointOverride(LOCAL_STACK.getEndpoint())
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(LOCAL_STACK.getAccessKey(), LOCAL_STACK.getSecretKey())))
                .region(Region.of(LOCAL_STACK.getRegion()))
                .forcePathStyle(true)
                .build();
    }

    @AfterAll
    static void closeClient() {
        s3.close();
    }

    @BeforeEach
    void setUp() {
        bucket = "backups-" + UUID.randomUUID().toString().substring(0, 8);
        s3.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        destination = new S3BackupDestination(s3, "s3://" + bucket + "/tenant-a/pg");
    }

    @Test
    void uploadListGetAndDeleteShouldWorkUnderPrefix() throws Exception {
        Path local = Files.writeString(tmp.resolve(name(1)), "dump-bytes");

        String key = destination.uploadBackup(local);

        assertEquals("tenant-a/pg/" + name(1), key);
        List<BackupArtifact> listing = destination.listBackups();
        assertEquals(1, listing.size());
        assertEquals(name(1), listing.get(0).name());
        assertEquals(10, listing.get(0).size());

        Path fetched = destination.getBackup(key, tmp.resolve("fetched.dump"));
        assertEquals("dump-bytes", Files.readString(fetched));

        destination.deleteBackup(key);
        assertTrue(destination.listBackups().isEmpty());
    }

    @Test
    void largeCommitShouldCopyInParts() throws Exception {
        int partSize = 5 * 1024 * 1024;
        S3BackupDestination multipart = new S3BackupDestination(s3, "s3://" + bucket + "/tenant-a/pg", partSize, partSize);
        byte[] payload = new byte[partSize + 1024 * 1024];
        new Random(7).nextBytes(payload);
        Path local = Files.write(tmp.resolve(name(5)), payload);

        String key = multipart.uploadBackup(local);

        List<BackupArtifact> listing = multipart.listBackups();
        assertEquals(1, listing.size());
        assertEquals(payload.length, listing.get(0).size());
        assertThat(Files.readAllBytes(multipart.getBackup(key, tmp.resolve("fetched.dump")))).isEqualTo(payload);
        assertTrue(s3.listObjectsV2(ListObjectsV2Request.builder().bucket(bucket).build()).contents().stream()
                .noneMatch(o -> o.key().contains(ArtifactNames.provisional(name(5)))));
    }

    @Test
    void listingShouldIgnoreProvisionalAndNestedObjects() throws Exception {
        destination.uploadBackup(Files.writeString(tmp.resolve(name(1)), "a"));
        put("tenant-a/pg/" + ArtifactNames.provisional(name(2)));
        put("tenant-a/pg/older/" + name(3));
        put("elsewhere/" + name(4));

        assertThat(destination.listBackups()).extracting(BackupArtifact::name).containsExactly(name(1));
    }

    @Test
    void unparseableObjectShouldFailListing() {
        put("tenant-a/pg/readme.md");

        assertThrows(AdapterTransportException.class, destination::listBackups);
    }

    @Test
    void testConnectionShouldReflectBucketExistence() {
        assertTrue(destination.testConnection());
        assertThat(new S3BackupDestination(s3, "s3://missing-bucket-xyz").testConnection()).isFalse();
    }

    private void put(String key) {
        s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(), RequestBody.fromString("x"));
    }

    private static String name(int second) {
        return ArtifactNames.format("postgres", "tenant-a", "7", "src-1", LocalDateTime.of(2024, 5, 1, 12, 0, second), "dump");
    }
}
