package com.carelogs.common.service;

import com.carelogs.common.exception.ObjectStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Supabase Storage implementation of ObjectStoreReader.
 *
 * The event's bucket name is used when present; otherwise the configured default bucket.
 */
@Slf4j
public class SupabaseStorageService implements ObjectStoreReader {

    private final WebClient webClient;
    private final String supabaseUrl;
    private final String serviceKey;
    private final String defaultBucket;

    public SupabaseStorageService(String supabaseUrl, String serviceKey, String defaultBucket) {
        this(supabaseUrl, serviceKey, defaultBucket, WebClient.builder());
    }

    public SupabaseStorageService(String supabaseUrl, String serviceKey, String defaultBucket,
            WebClient.Builder webClientBuilder) {
        this.supabaseUrl = supabaseUrl;
        this.serviceKey = serviceKey;
        this.defaultBucket = defaultBucket;
        this.webClient = webClientBuilder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024)) // 10MB
                .build();
    }

    @Override
    public String getProviderName() {
        return "Supabase Storage";
    }

    /**
     * Download file content directly (for processing)
     */
    @Override
    public byte[] get(String bucket, String key) {
        String bucketName = bucket == null || bucket.isBlank() ? defaultBucket : bucket;
        String objectPath = bucketName + "/" + key;

        try {
            byte[] content = webClient
                    .get()
                    .uri(supabaseUrl + "/storage/v1/object/" + objectPath)
                    .header("Authorization", "Bearer " + serviceKey)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();

            if (content == null) {
                throw new ObjectStoreException(ObjectStoreException.Reason.NOT_FOUND,
                        "Empty response body for " + objectPath, null);
            }
            log.debug("Downloaded {} bytes from Supabase Storage: {}", content.length, objectPath);
            return content;

        } catch (WebClientResponseException e) {
            ObjectStoreException.Reason reason = switch (e.getStatusCode().value()) {
                case 400, 404 -> ObjectStoreException.Reason.NOT_FOUND;
                case 401, 403 -> ObjectStoreException.Reason.ACCESS_DENIED;
                default -> ObjectStoreException.Reason.OTHER;
            };
            throw new ObjectStoreException(reason,
                    "Supabase Storage returned " + e.getStatusCode().value() + " for " + objectPath, e);
        } catch (WebClientException e) {
            throw new ObjectStoreException(ObjectStoreException.Reason.OTHER,
                    "Failed to download " + objectPath + ": " + e.getMessage(), e);
        }
    }
}
