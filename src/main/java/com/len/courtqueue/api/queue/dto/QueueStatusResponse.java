package com.len.courtqueue.api.queue.dto;

import com.len.courtqueue.application.queue.QueueView;
import com.len.courtqueue.domain.queue.QueueEntry;

import java.util.List;

public record QueueStatusResponse(
        String resourceId,
        String resourceName,
        int queueLength,
        List<QueueUser> users,
        int averageWaitTime   // 분
) {
    public static QueueStatusResponse from(QueueView view) {
        return new QueueStatusResponse(
                view.courtId(),
                view.courtName(),
                view.queueLength(),
                view.users().stream().map(QueueUser::from).toList(),
                view.averageWaitTime()
        );
    }

    public record QueueUser(
            String userId,
            String userName,
            String teamId,
            int position,
            String joinedAt   // ISO-8601, 없으면 ""
    ) {
        static QueueUser from(QueueEntry entry) {
            return new QueueUser(
                    entry.userId(),
                    entry.userName(),
                    entry.teamId() == null ? "" : entry.teamId(),
                    entry.position(),
                    entry.joinedAt() == null ? "" : entry.joinedAt().toString()
            );
        }
    }
}
