package com.infomedia.merchanthub.service;

import com.infomedia.merchanthub.exception.FileStorageException;
import com.infomedia.merchanthub.multitenancy.TenantContext;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveBucketArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object storage of the active tenant. Every tenant writes to its own bucket, taken from the
 * file namespace of the tenant context, so files never cross tenants.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class TenantFileStorageService {

    private static final long UNKNOWN_SIZE_PART = 10485760;

    private final MinioClient minioClient;

    // Buckets already known to exist, saves a round trip per upload
    private final Set<String> checkedBuckets = ConcurrentHashMap.newKeySet();

    public StoredFile upload(String objectName, InputStream inputStream, long size, String contentType) {
        String bucketName = currentBucket();
        ensureBucketExists(bucketName);

        try {
            log.debug("Uploading to MinIO. Bucket: {}, Object: {}, Size: {}", bucketName, objectName, size);
            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(bucketName)
                            .object(objectName)
                            .stream(inputStream, size, size == -1 ? UNKNOWN_SIZE_PART : -1)
                            .contentType(contentType)
                            .build());
            return new StoredFile(bucketName, objectName);
        } catch (Exception e) {
            log.error("Error uploading object {} to bucket {}", objectName, bucketName, e);
            throw new FileStorageException("Upload of '" + objectName + "' failed", e);
        }
    }

    /**
     * Caller is responsible for closing the stream.
     */
    public InputStream download(String objectName) {
        String bucketName = currentBucket();
        try {
            return minioClient.getObject(
                    GetObjectArgs.builder()
                            .bucket(bucketName)
                            .object(objectName)
                            .build());
        } catch (Exception e) {
            log.error("Error downloading object {} from bucket {}", objectName, bucketName, e);
            throw new FileStorageException("Download of '" + objectName + "' failed", e);
        }
    }

    public void delete(String objectName) {
        String bucketName = currentBucket();
        try {
            minioClient.removeObject(
                    RemoveObjectArgs.builder()
                            .bucket(bucketName)
                            .object(objectName)
                            .build());
            log.debug("Deleted object {} from bucket {}", objectName, bucketName);
        } catch (Exception e) {
            throw new FileStorageException("Delete of '" + objectName + "' failed", e);
        }
    }

    /**
     * Removes every object of a tenant bucket and the bucket itself. Used when the tenant is deleted.
     */
    public void purgeNamespace(String bucketName) {
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build())) {
                log.debug("Bucket {} does not exist, nothing to purge", bucketName);
                return;
            }
            int removed = 0;
            for (Result<Item> result : minioClient.listObjects(
                    ListObjectsArgs.builder().bucket(bucketName).recursive(true).build())) {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucketName)
                        .object(result.get().objectName())
                        .build());
                removed++;
            }
            minioClient.removeBucket(RemoveBucketArgs.builder().bucket(bucketName).build());
            checkedBuckets.remove(bucketName);
            log.info("Purged bucket {} ({} object(s))", bucketName, removed);
        } catch (Exception e) {
            throw new FileStorageException("Purge of bucket '" + bucketName + "' failed", e);
        }
    }

    private void ensureBucketExists(String bucketName) {
        if (checkedBuckets.contains(bucketName)) {
            return;
        }

        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build());
            if (!found) {
                log.info("Bucket {} does not exist. Creating it...", bucketName);
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucketName).build());
            }
            checkedBuckets.add(bucketName);
        } catch (ErrorResponseException e) {
            // Another instance created it first
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                checkedBuckets.add(bucketName);
            } else {
                throw new FileStorageException("Could not check/create bucket: " + bucketName, e);
            }
        } catch (Exception e) {
            throw new FileStorageException("Could not check/create bucket: " + bucketName, e);
        }
    }

    private static String currentBucket() {
        return TenantContext.requireCurrent().fileNamespace();
    }

    public record StoredFile(String bucketName, String objectName) {
    }
}
