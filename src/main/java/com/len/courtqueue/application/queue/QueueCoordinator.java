package com.len.courtqueue.application.queue;

import com.len.courtqueue.application.notification.NotificationPublisher;
import com.len.courtqueue.application.notification.QueueNotification;
import com.len.courtqueue.common.exception.BusinessException;
import com.len.courtqueue.common.exception.ErrorCode;
import com.len.courtqueue.domain.court.CourtLookup;
import com.len.courtqueue.domain.queue.CourtQueue;
import com.len.courtqueue.domain.queue.QueueEntry;
import com.len.courtqueue.domain.queue.QueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class QueueCoordinator {

    static final int SLOT_MINUTES = 30;          // 1명당 예상 이용 시간(분)
    static final String UNKNOWN_COURT_NAME = "Unknown";

    static final String MSG_JOINED = "Successfully joined the queue";
    static final String MSG_ALREADY_QUEUED = "You are already in the queue";
    static final String MSG_LEFT = "Successfully left the queue";
    static final String MSG_NOT_QUEUED = "You are not in this queue";

    private final QueueStore queueStore;
    private final CourtLookup courtLookup;
    private final NotificationPublisher notificationPublisher;

    @Value("${courtqueue.queue.max-write-attempts:5}")
    private int maxWriteAttempts;

    public List<QueueView> listAll() {
        return queueStore.findAll().stream()
                .sorted(Comparator.comparing(CourtQueue::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(CourtQueue::getCourtId))
                .map(QueueView::of)
                .toList();
    }

    /**
     * 대기열이 아직 없으면 빈 뷰를 돌려준다 (NOT_FOUND 아님)
     */
    public QueueView status(String courtId) {
        requireText(courtId, "resourceId");
        return queueStore.find(courtId)
                .map(QueueView::of)
                .orElseGet(() -> QueueView.empty(courtId));
    }

    public QueueActionResult join(String courtId, String userId, String userName, String teamId) {
        requireText(courtId, "resourceId");
        requireText(userId, "userId");
        requireText(userName, "userName");

        CourtLookup.CourtInfo court = courtLookup.find(courtId)
                .orElseThrow(() -> new BusinessException(ErrorCode.COURT_NOT_FOUND, "Court not found: " + courtId));

        long backoffMs = 10;
        for (int attempt = 1; ; attempt++) {
            Instant now = Instant.now();
            CourtQueue queue = queueStore.find(courtId)
                    .orElseGet(() -> CourtQueue.open(courtId, court.name(), now));

            Optional<QueueEntry> existing = queue.findEntry(userId);
            if (existing.isPresent()) {
                int position = existing.get().position();
                return new QueueActionResult(false, MSG_ALREADY_QUEUED, position, position * SLOT_MINUTES);
            }

            QueueEntry entry = queue.enqueue(userId, userName, teamId, now);
            if (queueStore.saveIfVersionMatches(queue)) {
                log.info("[QUEUE_JOIN] courtId={}, userId={}, position={}, attempt={}",
                        courtId, userId, entry.position(), attempt);
                notify(QueueNotification.joined(courtId, queue.getCourtName(), userId, userName,
                        entry.position(), queue.size(), now));
                return new QueueActionResult(true, MSG_JOINED, entry.position(), entry.position() * SLOT_MINUTES);
            }

            backoffMs = onConflict(courtId, attempt, backoffMs);
        }
    }

    public QueueActionResult leave(String courtId, String userId) {
        requireText(courtId, "resourceId");
        requireText(userId, "userId");

        long backoffMs = 10;
        for (int attempt = 1; ; attempt++) {
            Instant now = Instant.now();
            CourtQueue queue = queueStore.find(courtId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.QUEUE_NOT_FOUND, "Queue not found: " + courtId));

            Optional<QueueEntry> existing = queue.findEntry(userId);
            if (existing.isEmpty()) {
                return new QueueActionResult(false, MSG_NOT_QUEUED, 0, 0);
            }

            queue.remove(userId, now);
            if (queueStore.saveIfVersionMatches(queue)) {
                log.info("[QUEUE_LEAVE] courtId={}, userId={}, remaining={}, attempt={}",
                        courtId, userId, queue.size(), attempt);
                notify(QueueNotification.left(courtId, queue.getCourtName(), userId,
                        existing.get().userName(), queue.size(), now));
                return new QueueActionResult(true, MSG_LEFT, 0, 0);
            }

            backoffMs = onConflict(courtId, attempt, backoffMs);
        }
    }

    /**
     * 버전 충돌: 다시 읽어서 재적용. 한도를 넘으면 INTERNAL
     */
    private long onConflict(String courtId, int attempt, long backoffMs) {
        int limit = Math.max(1, maxWriteAttempts);
        if (attempt >= limit) {
            log.warn("[QUEUE_CONFLICT] courtId={}, attempts={} - giving up", courtId, attempt);
            throw new BusinessException(ErrorCode.QUEUE_UPDATE_CONFLICT);
        }
        log.debug("[QUEUE_CONFLICT] courtId={}, attempt={}, retry in {}ms", courtId, attempt, backoffMs);
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.QUEUE_UPDATE_CONFLICT);
        }
        return Math.min(backoffMs * 2, 100);
    }

    // 알림 실패가 join/leave 응답을 깨뜨리면 안 된다
    private void notify(QueueNotification notification) {
        try {
            notificationPublisher.broadcast(notification);
        } catch (RuntimeException e) {
            log.warn("[NOTIFY_FAILED] type={}, courtId={}", notification.type(), notification.resourceId(), e);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, field + " is required");
        }
    }
}
