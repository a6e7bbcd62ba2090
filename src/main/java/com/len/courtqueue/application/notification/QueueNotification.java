package com.len.courtqueue.application.notification;

import java.time.Instant;

public record QueueNotification(
        String type,          // "QUEUE_JOINED" / "QUEUE_LEFT"
        String resourceId,
        String resourceName,
        String userId,
        String userName,
        int position,         // LEFT면 0
        int queueLength,
        String message,
        Instant occurredAt
) {

    public static final String JOINED = "QUEUE_JOINED";
    public static final String LEFT = "QUEUE_LEFT";

    public static QueueNotification joined(String courtId, String courtName, String userId, String userName,
                                           int position, int queueLength, Instant now) {
        return new QueueNotification(
                JOINED, courtId, courtName, userId, userName, position, queueLength,
                "You joined the queue for " + courtName + " at position " + position,
                now
        );
    }

    public static QueueNotification left(String courtId, String courtName, String userId, String userName,
                                         int queueLength, Instant now) {
        return new QueueNotification(
                LEFT, courtId, courtName, userId, userName, 0, queueLength,
                "You left the queue for " + courtName,
                now
        );
    }
}
