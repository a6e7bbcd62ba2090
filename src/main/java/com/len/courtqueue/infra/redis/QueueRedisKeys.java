package com.len.courtqueue.infra.redis;

public final class QueueRedisKeys {

    public static final String QUEUE_PREFIX = "court-queue:";        // hash: court-queue:{courtId}
    public static final String COURT_INDEX_KEY = "court-queue-index"; // set: 대기열이 있는 courtId 전체

    public static final String FIELD_DOC = "doc";
    public static final String FIELD_VERSION = "version";

    private QueueRedisKeys() {}

    public static String queueKey(String courtId) {
        return QUEUE_PREFIX + courtId;
    }
}
