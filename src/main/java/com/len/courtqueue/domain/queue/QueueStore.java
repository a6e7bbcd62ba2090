package com.len.courtqueue.domain.queue;

import java.util.List;
import java.util.Optional;

public interface QueueStore {

    /**
     * 코트 대기열 조회 (없으면 empty)
     */
    Optional<CourtQueue> find(String courtId);

    /**
     * 저장된 전체 대기열
     */
    List<CourtQueue> findAll();

    /**
     * queue.getVersion() 이 저장소의 현재 버전과 같을 때만 문서 전체를 덮어쓴다.
     * @return 커밋됐으면 true, 버전 충돌이면 false
     */
    boolean saveIfVersionMatches(CourtQueue queue);
}
