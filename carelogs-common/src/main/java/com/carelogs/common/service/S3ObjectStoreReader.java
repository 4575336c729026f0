package com.carelogs.common.service;

import com.carelogs.common.exception.ObjectStoreException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Amazon S3 implementation of ObjectStoreReader
 */
@Slf4j
public class S3ObjectStoreReader implements ObjectStoreReader {

    private final S3Client s3Client;

    public S3ObjectStoreReader(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public String getProviderName() {
        return "Amazon S3";
    }

    @Override
    public byte[] get(String bucket, String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            byte[] content = s3Client.getObjectAsBytes(request).asByteArray();
            log.debug("Downloaded {} bytes from s3://{}/{}", content.length, bucket, key);
            return content;
        } catch (NoSuchKeyException e) {
            throw new ObjectStoreException(ObjectStoreException.Reason.NOT_FOUND,
                    "No such object: s3://" + bucket + "/" + key, e);
        } catch (S3Exception e) {
            ObjectStoreException.Reason reason = e.statusCode() == 403
                    ? ObjectStoreException.Reason.ACCESS_DENIED
                    : e.statusCode() == 404 ? ObjectStoreException.Reason.NOT_FOUND
                            : ObjectStoreException.Reason.OTHER;
            throw new ObjectStoreException(reason,
                    "S3 rejected GetObject for s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new ObjectStoreException(ObjectStoreException.Reason.OTHER,
                    "Failed to download s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }
}
