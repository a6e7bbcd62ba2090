package com.len.courtqueue.infra.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.courtqueue.domain.queue.CourtQueue;
import com.len.courtqueue.domain.queue.QueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 코트별 대기열을 Redis hash 하나(doc + version)에 문서째로 저장한다.
 * 쓰기는 Lua 스크립트로 version 비교 후 교체 (원자적).
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class RedisQueueStore implements QueueStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    private final DefaultRedisScript<Long> saveScript = new DefaultRedisScript<>() {{
        setLocation(new ClassPathResource("redis/queue_save_if_version.lua"));
        setResultType(Long.class);
    }};

    @Override
    public Optional<CourtQueue> find(String courtId) {
        List<Object> values = redisTemplate.opsForHash().multiGet(
                QueueRedisKeys.queueKey(courtId),
                List.of(QueueRedisKeys.FIELD_DOC, QueueRedisKeys.FIELD_VERSION)
        );
        if (values == null || values.isEmpty() || values.get(0) == null) {
            return Optional.empty();
        }

        String doc = (String) values.get(0);
        long version = values.get(1) == null ? 0L : Long.parseLong((String) values.get(1));

        try {
            CourtQueueDocument document = objectMapper.readValue(doc, CourtQueueDocument.class);
            return Optional.of(document.toDomain(version));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Queue document corrupted. courtId=" + courtId, e);
        }
    }

    @Override
    public List<CourtQueue> findAll() {
        Set<String> courtIds = redisTemplate.opsForSet().members(QueueRedisKeys.COURT_INDEX_KEY);
        if (courtIds == null || courtIds.isEmpty()) {
            return List.of();
        }

        List<CourtQueue> queues = new ArrayList<>(courtIds.size());
        for (String courtId : courtIds) {
            find(courtId).ifPresent(queues::add);
        }
        return queues;
    }

    @Override
    public boolean saveIfVersionMatches(CourtQueue queue) {
        String json;
        try {
            json = objectMapper.writeValueAsString(CourtQueueDocument.from(queue));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Queue document serialize failed. courtId=" + queue.getCourtId(), e);
        }

        Long result = redisTemplate.execute(
                saveScript,
                List.of(
                        QueueRedisKeys.queueKey(queue.getCourtId()),
                        QueueRedisKeys.COURT_INDEX_KEY
                ),
                String.valueOf(queue.getVersion()),
                json,
                queue.getCourtId()
        );

        if (result == null || result < 0) {
            log.debug("Version mismatch. courtId={}, expectedVersion={}", queue.getCourtId(), queue.getVersion());
            return false;
        }
        return true;
    }
}
