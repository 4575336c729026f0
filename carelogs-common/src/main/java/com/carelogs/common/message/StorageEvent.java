package com.carelogs.common.message;

import java.util.List;

/**
 * Parsed triggering event.
 *
 * @param recordCount   number of top-level event records, reported back in the acknowledgment
 * @param notifications uploaded objects in event order
 */
public record StorageEvent(int recordCount, List<StorageNotification> notifications) {

    public StorageEvent {
        notifications = List.copyOf(notifications);
    }
}
