package com.len.courtqueue.domain.queue;

import java.time.Instant;

public record QueueEntry(
        String userId,
        String userName,
        String teamId,        // 없으면 ""
        int position,         // 1부터 시작
        Instant joinedAt
) {

    public QueueEntry withPosition(int newPosition) {
        return new QueueEntry(userId, userName, teamId, newPosition, joinedAt);
    }
}
