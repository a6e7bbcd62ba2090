package com.len.courtqueue.domain.queue;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 코트 하나의 대기열 (문서 1개 = 코트 1개).
 *
 * 항상 entries[i].position == i + 1 을 유지한다.
 * 순번 변경은 enqueue / remove 를 통해서만 일어난다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class CourtQueue {

    private String courtId;
    private String courtName;
    private List<QueueEntry> entries;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * 낙관적 동시성 토큰. 0 = 아직 저장된 적 없음
     */
    private long version;

    public static CourtQueue open(String courtId, String courtName, Instant now) {
        CourtQueue q = new CourtQueue();
        q.courtId = courtId;
        q.courtName = courtName;
        q.entries = new ArrayList<>();
        q.createdAt = now;
        q.updatedAt = now;
        q.version = 0L;
        return q;
    }

    public static CourtQueue restore(String courtId,
                                     String courtName,
                                     List<QueueEntry> entries,
                                     Instant createdAt,
                                     Instant updatedAt,
                                     long version) {
        CourtQueue q = new CourtQueue();
        q.courtId = courtId;
        q.courtName = courtName;
        q.entries = new ArrayList<>(entries == null ? List.of() : entries);
        q.createdAt = createdAt;
        q.updatedAt = updatedAt;
        q.version = version;
        // 저장소에 깨진 순번이 들어있어도 읽는 순간 바로잡는다
        q.renumber();
        return q;
    }

    public List<QueueEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public Optional<QueueEntry> findEntry(String userId) {
        return entries.stream()
                .filter(e -> e.userId().equals(userId))
                .findFirst();
    }

    /**
     * 맨 뒤에 추가. 이미 있는 userId면 IllegalStateException
     */
    public QueueEntry enqueue(String userId, String userName, String teamId, Instant now) {
        if (findEntry(userId).isPresent()) {
            throw new IllegalStateException("already queued: " + userId);
        }
        QueueEntry entry = new QueueEntry(
                userId,
                userName,
                teamId == null ? "" : teamId,
                entries.size() + 1,
                now
        );
        entries.add(entry);
        this.updatedAt = now;
        return entry;
    }

    /**
     * 제거 후 남은 항목을 기존 순서대로 1..n 재부여
     * @return 제거했으면 true
     */
    public boolean remove(String userId, Instant now) {
        boolean removed = entries.removeIf(e -> e.userId().equals(userId));
        if (!removed) {
            return false;
        }
        renumber();
        this.updatedAt = now;
        return true;
    }

    private void renumber() {
        for (int i = 0; i < entries.size(); i++) {
            QueueEntry e = entries.get(i);
            if (e.position() != i + 1) {
                entries.set(i, e.withPosition(i + 1));
            }
        }
    }
}
