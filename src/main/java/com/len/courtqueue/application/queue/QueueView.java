package com.len.courtqueue.application.queue;

import com.len.courtqueue.domain.queue.CourtQueue;
import com.len.courtqueue.domain.queue.QueueEntry;

import java.util.List;

public record QueueView(
        String courtId,
        String courtName,
        int queueLength,
        List<QueueEntry> users,
        int averageWaitTime   // 분
) {

    static QueueView of(CourtQueue queue) {
        int length = queue.size();
        return new QueueView(
                queue.getCourtId(),
                queue.getCourtName(),
                length,
                queue.getEntries(),
                length * QueueCoordinator.SLOT_MINUTES
        );
    }

    static QueueView empty(String courtId) {
        return new QueueView(courtId, QueueCoordinator.UNKNOWN_COURT_NAME, 0, List.of(), 0);
    }
}
