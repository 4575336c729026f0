package com.carelogs.common.service;

import com.carelogs.common.exception.ObjectStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SupabaseStorageService: request shape and status mapping, against a
 * stubbed exchange function instead of a live Supabase project.
 */
class SupabaseStorageServiceTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private SupabaseStorageService serviceReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status).body(body).build());
        });
        return new SupabaseStorageService("https://project.supabase.co", "service-key", "visit-batches", builder);
    }

    @Test
    @DisplayName("Should download from the event's bucket with the service key")
    void get_shouldUseEventBucket() {
        SupabaseStorageService service = serviceReturning(HttpStatus.OK, "[]");

        byte[] result = service.get("care-uploads", "batch-001.json");

        assertEquals("[]", new String(result));
        assertEquals("https://project.supabase.co/storage/v1/object/care-uploads/batch-001.json",
                requests.get(0).url().toString());
        assertEquals("Bearer service-key", requests.get(0).headers().getFirst("Authorization"));
    }

    @Test
    @DisplayName("Should fall back to the configured bucket when the event has none")
    void get_shouldFallBackToDefaultBucket() {
        SupabaseStorageService service = serviceReturning(HttpStatus.OK, "[]");

        service.get("", "batch-001.json");

        assertEquals("https://project.supabase.co/storage/v1/object/visit-batches/batch-001.json",
                requests.get(0).url().toString());
    }

    @Test
    @DisplayName("Should map 404 to NOT_FOUND and 403 to ACCESS_DENIED")
    void get_shouldMapErrorStatuses() {
        ObjectStoreException notFound = assertThrows(ObjectStoreException.class,
                () -> serviceReturning(HttpStatus.NOT_FOUND, "{}").get("care-uploads", "missing.json"));
        ObjectStoreException denied = assertThrows(ObjectStoreException.class,
                () -> serviceReturning(HttpStatus.FORBIDDEN, "{}").get("care-uploads", "batch-001.json"));

        assertEquals(ObjectStoreException.Reason.NOT_FOUND, notFound.getReason());
        assertEquals(ObjectStoreException.Reason.ACCESS_DENIED, denied.getReason());
    }
}
