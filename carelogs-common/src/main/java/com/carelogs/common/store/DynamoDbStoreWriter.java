package com.carelogs.common.store;

import com.carelogs.common.exception.StoreWriteException;
import com.carelogs.common.model.OutputItem;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteResult;
import software.amazon.awssdk.enhanced.dynamodb.model.WriteBatch;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Amazon DynamoDB implementation of KeyValueStoreWriter, through the Enhanced Client's
 * batchWriteItem.
 *
 * Unprocessed puts returned by DynamoDB (throttling) are resent up to
 * {@code maxResendAttempts} times, waiting {@code resendBackoff}, then twice that, and so
 * on between attempts. Anything still unprocessed after that fails the call.
 */
@Slf4j
public class DynamoDbStoreWriter implements KeyValueStoreWriter {

    // Hard limit of BatchWriteItem
    public static final int MAX_BATCH_WRITE_ITEMS = 25;

    private final DynamoDbEnhancedClient enhancedClient;
    private final int maxResendAttempts;
    private final Duration resendBackoff;
    private final Map<Class<?>, TableSchema<?>> schemas = new ConcurrentHashMap<>();

    public DynamoDbStoreWriter(DynamoDbEnhancedClient enhancedClient, int maxResendAttempts, Duration resendBackoff) {
        this.enhancedClient = enhancedClient;
        this.maxResendAttempts = maxResendAttempts;
        this.resendBackoff = resendBackoff;
    }

    @Override
    public int maxItemsPerRequest() {
        return MAX_BATCH_WRITE_ITEMS;
    }

    @Override
    public <T extends OutputItem> void batchPut(String tableName, Class<T> itemType, List<T> items) {
        if (items.size() > MAX_BATCH_WRITE_ITEMS) {
            throw new IllegalArgumentException(
                    "BatchWriteItem accepts at most " + MAX_BATCH_WRITE_ITEMS + " items, got " + items.size());
        }
        if (items.isEmpty()) {
            return;
        }

        DynamoDbTable<T> table = enhancedClient.table(tableName, schemaFor(itemType));
        List<T> pending = items;
        int attempt = 0;

        try {
            while (true) {
                WriteBatch.Builder<T> writeBatch = WriteBatch.builder(itemType).mappedTableResource(table);
                pending.forEach(writeBatch::addPutItem);

                BatchWriteResult result = enhancedClient.batchWriteItem(BatchWriteItemEnhancedRequest.builder()
                        .writeBatches(writeBatch.build())
                        .build());

                pending = result.unprocessedPutItemsForTable(table);
                if (pending.isEmpty()) {
                    return;
                }

                attempt++;
                if (attempt > maxResendAttempts) {
                    throw new StoreWriteException(pending.size() + " items left unprocessed in table '"
                            + tableName + "' after " + maxResendAttempts + " resends");
                }
                log.warn("DynamoDB left {} items unprocessed in '{}', resending (attempt {}/{})",
                        pending.size(), tableName, attempt, maxResendAttempts);
                backOff(attempt, tableName);
            }
        } catch (AwsServiceException e) {
            String errorCode = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : "Unknown";
            throw new StoreWriteException("DynamoDB rejected batch write to '" + tableName + "': "
                    + e.getMessage(), errorCode, e);
        } catch (SdkException e) {
            throw new StoreWriteException("Batch write to '" + tableName + "' failed: " + e.getMessage(),
                    "Unknown", e);
        }
    }

    private void backOff(int attempt, String tableName) {
        long delayMillis = resendBackoff.toMillis() << (attempt - 1);
        if (delayMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreWriteException("Interrupted while waiting to resend to '" + tableName + "'",
                    "Interrupted", e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> TableSchema<T> schemaFor(Class<T> itemType) {
        return (TableSchema<T>) schemas.computeIfAbsent(itemType, TableSchema::fromBean);
    }
}
