package com.carelogs.common.message;

/**
 * One uploaded object named by a triggering event.
 */
public record StorageNotification(String bucket, String key) {

    public String location() {
        return "s3://" + bucket + "/" + key;
    }
}
