package com.len.courtqueue.test.mocks;

import com.len.courtqueue.domain.queue.CourtQueue;
import com.len.courtqueue.domain.queue.QueueStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 버전 비교까지 Redis 구현과 같은 규칙으로 동작하는 테스트용 저장소.
 * failNextSaves(n) 으로 다음 n 번의 저장을 버전 충돌로 만들 수 있다.
 */
public class InMemoryQueueStore implements QueueStore {

    private final Map<String, CourtQueue> queues = new ConcurrentHashMap<>();
    private final AtomicInteger forcedConflicts = new AtomicInteger();
    private final AtomicInteger saveCalls = new AtomicInteger();

    @Override
    public Optional<CourtQueue> find(String courtId) {
        CourtQueue stored = queues.get(courtId);
        return Optional.ofNullable(stored).map(InMemoryQueueStore::copy);
    }

    @Override
    public List<CourtQueue> findAll() {
        List<CourtQueue> result = new ArrayList<>();
        queues.values().forEach(q -> result.add(copy(q)));
        return result;
    }

    @Override
    public synchronized boolean saveIfVersionMatches(CourtQueue queue) {
        saveCalls.incrementAndGet();
        if (forcedConflicts.get() > 0) {
            forcedConflicts.decrementAndGet();
            return false;
        }

        CourtQueue current = queues.get(queue.getCourtId());
        long currentVersion = current == null ? 0L : current.getVersion();
        if (currentVersion != queue.getVersion()) {
            return false;
        }

        queues.put(queue.getCourtId(), CourtQueue.restore(
                queue.getCourtId(),
                queue.getCourtName(),
                queue.getEntries(),
                queue.getCreatedAt(),
                queue.getUpdatedAt(),
                currentVersion + 1
        ));
        return true;
    }

    public void failNextSaves(int count) {
        forcedConflicts.set(count);
    }

    public int saveCalls() {
        return saveCalls.get();
    }

    private static CourtQueue copy(CourtQueue q) {
        return CourtQueue.restore(q.getCourtId(), q.getCourtName(), q.getEntries(),
                q.getCreatedAt(), q.getUpdatedAt(), q.getVersion());
    }
}
