package com.carelogs.pipeline.service;

import com.carelogs.common.exception.StoreWriteException;
import com.carelogs.common.model.OutputItem;
import com.carelogs.common.store.KeyValueStoreWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Writes a batch's output items to one key-value table.
 *
 * All-or-nothing per call: if any chunk is rejected the call reports 0 written, even though
 * earlier chunks may already be stored. Callers must not assume partial durability.
 */
@Slf4j
public class BulkPersister<T extends OutputItem> {

    private final KeyValueStoreWriter storeWriter;
    private final String tableName;
    private final Class<T> itemType;

    public BulkPersister(KeyValueStoreWriter storeWriter, String tableName, Class<T> itemType) {
        this.storeWriter = storeWriter;
        this.tableName = tableName;
        this.itemType = itemType;
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * @return number of items written, either {@code items.size()} or 0
     */
    public int persist(List<T> items) {
        if (items.isEmpty()) {
            log.info("No items to write to '{}'.", tableName);
            return 0;
        }

        int chunkSize = Math.max(1, storeWriter.maxItemsPerRequest());
        try {
            for (int start = 0; start < items.size(); start += chunkSize) {
                storeWriter.batchPut(tableName, itemType,
                        List.copyOf(items.subList(start, Math.min(start + chunkSize, items.size()))));
            }
            log.info("Successfully wrote {} items to '{}'.", items.size(), tableName);
            return items.size();

        } catch (StoreWriteException e) {
            log.error("Store error during batch write to '{}': {}", tableName, e.getMessage());
            log.error("Error code: {}", e.getErrorCode());
            return 0;
        } catch (RuntimeException e) {
            log.error("Unexpected error during batch write to '{}': {}", tableName, e.getMessage(), e);
            return 0;
        }
    }
}
