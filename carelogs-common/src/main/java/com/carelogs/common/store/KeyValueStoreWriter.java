package com.carelogs.common.store;

import com.carelogs.common.model.OutputItem;

import java.util.List;

/**
 * Write side of the key-value store that receives pipeline output.
 *
 * Callers must not send more than {@link #maxItemsPerRequest()} items in one
 * {@link #batchPut} call.
 */
public interface KeyValueStoreWriter {

    /**
     * Per-request item limit enforced by the store
     */
    int maxItemsPerRequest();

    /**
     * Put all items into the table in one request.
     *
     * @throws com.carelogs.common.exception.StoreWriteException if the store rejects the
     *                                                           request or leaves items
     *                                                           unwritten
     */
    <T extends OutputItem> void batchPut(String tableName, Class<T> itemType, List<T> items);
}
