package com.carelogs.common.model;

/**
 * Durable record written to the key-value store.
 *
 * Keyed by (record-or-client id, batch id) so reruns of one batch never collide with
 * another batch. Implementations are DynamoDB Enhanced Client beans.
 */
public interface OutputItem {

    String BATCH_ID_ATTRIBUTE = "batch_id";

    String getBatchId();
}
