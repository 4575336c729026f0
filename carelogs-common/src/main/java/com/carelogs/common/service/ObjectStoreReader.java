package com.carelogs.common.service;

/**
 * Read-only access to the object storage holding uploaded visit batches.
 *
 * Implementations raise {@link com.carelogs.common.exception.ObjectStoreException} for
 * missing objects, denied access and transport failures alike.
 */
public interface ObjectStoreReader {

    /**
     * Download the full content of one object
     */
    byte[] get(String bucket, String key);

    /**
     * Name of the storage backend (for logging)
     */
    String getProviderName();
}
