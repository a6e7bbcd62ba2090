package com.len.courtqueue.infra.redis;

import com.len.courtqueue.domain.queue.CourtQueue;
import com.len.courtqueue.domain.queue.QueueEntry;

import java.time.Instant;
import java.util.List;

/**
 * Redis "doc" 필드에 저장되는 JSON 형태. version 은 별도 필드라 여기엔 없다.
 */
public record CourtQueueDocument(
        String courtId,
        String courtName,
        List<QueueEntry> users,
        Instant createdAt,
        Instant updatedAt
) {

    public static CourtQueueDocument from(CourtQueue queue) {
        return new CourtQueueDocument(
                queue.getCourtId(),
                queue.getCourtName(),
                queue.getEntries(),
                queue.getCreatedAt(),
                queue.getUpdatedAt()
        );
    }

    public CourtQueue toDomain(long version) {
        return CourtQueue.restore(courtId, courtName, users, createdAt, updatedAt, version);
    }
}
