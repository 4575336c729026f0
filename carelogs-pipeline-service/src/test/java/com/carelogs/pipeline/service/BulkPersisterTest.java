package com.carelogs.pipeline.service;

import com.carelogs.common.exception.StoreWriteException;
import com.carelogs.common.model.ClientSummaryItem;
import com.carelogs.common.store.KeyValueStoreWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BulkPersister: chunking and all-or-nothing accounting.
 */
@ExtendWith(MockitoExtension.class)
class BulkPersisterTest {

    private static final String TABLE = "awslambdahackathonsummaries";

    @Mock
    private KeyValueStoreWriter storeWriter;

    private BulkPersister<ClientSummaryItem> persister;

    @BeforeEach
    void setUp() {
        persister = new BulkPersister<>(storeWriter, TABLE, ClientSummaryItem.class);
    }

    private static List<ClientSummaryItem> items(int count) {
        List<ClientSummaryItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(new ClientSummaryItem("client-" + i, "batch-0042", "2024-01-03", 1,
                    "Stable.", "2024-02-01T09:00"));
        }
        return items;
    }

    @Test
    @DisplayName("Should write nothing and report 0 for no items")
    void persist_empty_shouldNotCallStore() {
        assertEquals(0, persister.persist(List.of()));
        verifyNoInteractions(storeWriter);
    }

    @Test
    @DisplayName("Should split items into chunks of the writer's request limit")
    @SuppressWarnings("unchecked")
    void persist_shouldChunkByRequestLimit() {
        when(storeWriter.maxItemsPerRequest()).thenReturn(25);

        int written = persister.persist(items(60));

        assertEquals(60, written);
        ArgumentCaptor<List<ClientSummaryItem>> chunks = ArgumentCaptor.forClass(List.class);
        verify(storeWriter, times(3)).batchPut(eq(TABLE), eq(ClientSummaryItem.class), chunks.capture());
        assertEquals(List.of(25, 25, 10), chunks.getAllValues().stream().map(List::size).toList());
        assertEquals("client-0", chunks.getAllValues().get(0).get(0).getClient());
        assertEquals("client-59", chunks.getAllValues().get(2).get(9).getClient());
    }

    @Test
    @DisplayName("Should report 0 when any chunk fails, even after earlier chunks were written")
    void persist_storeError_shouldReportZero() {
        when(storeWriter.maxItemsPerRequest()).thenReturn(25);
        doNothing()
                .doThrow(new StoreWriteException("Throughput exceeded", "ProvisionedThroughputExceededException", null))
                .when(storeWriter).batchPut(anyString(), any(), anyList());

        assertEquals(0, persister.persist(items(30)));
        verify(storeWriter, times(2)).batchPut(anyString(), any(), anyList());
    }

    @Test
    @DisplayName("Should report 0 on an unexpected writer error")
    void persist_unexpectedError_shouldReportZero() {
        when(storeWriter.maxItemsPerRequest()).thenReturn(25);
        doThrow(new IllegalStateException("client closed")).when(storeWriter).batchPut(anyString(), any(), anyList());

        assertEquals(0, persister.persist(items(3)));
    }
}
