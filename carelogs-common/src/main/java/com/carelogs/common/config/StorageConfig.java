package com.carelogs.common.config;

import com.carelogs.common.service.ObjectStoreReader;
import com.carelogs.common.service.S3ObjectStoreReader;
import com.carelogs.common.service.SupabaseStorageService;
import com.carelogs.common.store.DynamoDbStoreWriter;
import com.carelogs.common.store.KeyValueStoreWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Duration;

/**
 * Storage adapters: where batches are read from and where results are written to.
 *
 * - 'carelogs.storage.provider' selects the object store: "s3" (default) or "supabase"
 * - Results always go to DynamoDB
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Value("${carelogs.storage.provider:s3}")
    private String storageProvider;

    @Value("${supabase.url:}")
    private String supabaseUrl;

    @Value("${supabase.service-key:}")
    private String supabaseServiceKey;

    @Value("${supabase.bucket:}")
    private String supabaseBucket;

    @Value("${carelogs.store.max-resend-attempts:3}")
    private int maxResendAttempts;

    @Value("${carelogs.store.resend-backoff:100ms}")
    private Duration resendBackoff;

    @Bean
    public ObjectStoreReader objectStoreReader(ObjectProvider<S3Client> s3Client) {
        ObjectStoreReader reader = switch (storageProvider.toLowerCase()) {
            case "s3" -> new S3ObjectStoreReader(s3Client.getObject());
            case "supabase" -> new SupabaseStorageService(supabaseUrl, supabaseServiceKey, supabaseBucket);
            default -> throw new IllegalArgumentException(
                    "Unsupported storage provider: '" + storageProvider + "'. " +
                            "Supported providers: s3, supabase. " +
                            "Set 'carelogs.storage.provider' in application.yml.");
        };
        log.info("Object store: {}", reader.getProviderName());
        return reader;
    }

    @Bean
    public KeyValueStoreWriter keyValueStoreWriter(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        return new DynamoDbStoreWriter(dynamoDbEnhancedClient, maxResendAttempts, resendBackoff);
    }
}
