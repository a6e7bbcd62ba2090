package com.len.courtqueue.infra.sse;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * SSE 리스너마다 전용 Kafka consumer 를 붙여 알림 토픽을 그대로 흘려보내는 허브.
 *
 * consumer 는 group 에 가입하지 않는다 (assign + seekToEnd, 커밋 없음).
 * 그래서 연결 전에 발행된 이벤트는 받지 못하고, 연결이 끊기면 아무것도 남지 않는다.
 * durable 소비는 NotificationWorker 쪽 몫이다.
 */
@Slf4j
@Component
public class NotificationBridge {

    static final String METRIC_SESSIONS = "courtqueue.notification.sessions";
    static final String METRIC_SESSION_OPENED = "courtqueue.notification.session.opened";
    static final String METRIC_SESSION_FAILED = "courtqueue.notification.session.failed";

    private final Map<String, ListenerSession> sessions = new ConcurrentHashMap<>();

    private final ConsumerFactory<String, String> consumerFactory;
    private final ExecutorService relayExecutor;
    private final MeterRegistry meterRegistry;
    private final String topic;
    private final int bufferCapacity;
    private final int maxDropped;
    private final Duration pollTimeout;

    public NotificationBridge(
            ConsumerFactory<String, String> consumerFactory,
            @Qualifier("notificationRelayExecutor") ExecutorService relayExecutor,
            MeterRegistry meterRegistry,
            @Value("${courtqueue.notification.topic:court-queue.notifications}") String topic,
            @Value("${courtqueue.notification.buffer-capacity:256}") int bufferCapacity,
            @Value("${courtqueue.notification.max-dropped:1024}") int maxDropped,
            @Value("${courtqueue.notification.poll-timeout-ms:500}") long pollTimeoutMs
    ) {
        this.consumerFactory = consumerFactory;
        this.relayExecutor = relayExecutor;
        this.meterRegistry = meterRegistry;
        this.topic = topic;
        this.bufferCapacity = bufferCapacity;
        this.maxDropped = maxDropped;
        this.pollTimeout = Duration.ofMillis(pollTimeoutMs);

        meterRegistry.gauge(METRIC_SESSIONS, sessions, Map::size);
    }

    /**
     * SSE 구독(연결 생성)
     */
    public SseEmitter open() {
        // timeout 0 = 무제한. 정리는 클라이언트 종료 신호로 한다
        SseEmitter emitter = createEmitter();
        String sessionId = UUID.randomUUID().toString();

        ListenerSession session = new ListenerSession(
                sessionId, emitter, bufferCapacity, maxDropped, () -> sessions.remove(sessionId));
        sessions.put(sessionId, session);

        emitter.onCompletion(session::close);
        emitter.onTimeout(session::close);
        emitter.onError(ex -> session.close());

        if (!session.sendComment("connected")) {
            return emitter;
        }

        Consumer<String, String> consumer;
        try {
            consumer = subscribe(sessionId);
        } catch (RuntimeException e) {
            log.warn("[SSE_SUBSCRIBE_FAILED] sessionId={}, topic={}", sessionId, topic, e);
            fail(session);
            return emitter;
        }

        session.bind(consumer);

        try {
            relayExecutor.execute(() -> pollLoop(session, consumer));
        } catch (RejectedExecutionException e) {
            consumer.close();
            log.warn("[SSE_RELAY_REJECTED] sessionId={}", sessionId);
            fail(session);
            return emitter;
        }

        try {
            relayExecutor.execute(() -> sendLoop(session));
        } catch (RejectedExecutionException e) {
            // poll 루프가 wakeup 을 받고 consumer 를 닫는다
            log.warn("[SSE_RELAY_REJECTED] sessionId={}", sessionId);
            fail(session);
            return emitter;
        }

        meterRegistry.counter(METRIC_SESSION_OPENED).increment();
        log.info("SSE session opened. sessionId={}, active={}", sessionId, sessions.size());
        return emitter;
    }

    protected SseEmitter createEmitter() {
        return new SseEmitter(0L);
    }

    /**
     * 모든 세션에 ping. 끊긴 세션은 이 과정에서 정리된다
     */
    public void pingAll() {
        for (ListenerSession session : sessions.values()) {
            session.ping();
        }
    }

    public int activeSessions() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        for (ListenerSession session : new ArrayList<>(sessions.values())) {
            session.close();
        }
    }

    private Consumer<String, String> subscribe(String sessionId) {
        Properties overrides = new Properties();
        overrides.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        overrides.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");

        Consumer<String, String> consumer = consumerFactory.createConsumer(null, "sse-bridge-", sessionId, overrides);
        try {
            List<PartitionInfo> infos = consumer.partitionsFor(topic, Duration.ofSeconds(5));
            if (infos == null || infos.isEmpty()) {
                throw new IllegalStateException("No partitions for topic " + topic);
            }

            List<TopicPartition> partitions = infos.stream()
                    .map(p -> new TopicPartition(p.topic(), p.partition()))
                    .toList();

            consumer.assign(partitions);
            consumer.seekToEnd(partitions);
            // seekToEnd 는 lazy. 여기서 위치를 확정해야 "연결 이후" 이벤트만 받는다
            partitions.forEach(consumer::position);
            return consumer;

        } catch (RuntimeException e) {
            consumer.close();
            throw e;
        }
    }

    private void pollLoop(ListenerSession session, Consumer<String, String> consumer) {
        try {
            while (session.isOpen()) {
                ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
                for (ConsumerRecord<String, String> record : records) {
                    session.enqueue(record.value());
                }
            }
        } catch (WakeupException e) {
            log.debug("Poll loop woken up. sessionId={}", session.getId());
        } catch (RuntimeException e) {
            log.warn("[SSE_POLL_FAILED] sessionId={}", session.getId(), e);
            session.close();
        } finally {
            consumer.close();
            log.info("SSE session closed. sessionId={}, dropped={}, active={}",
                    session.getId(), session.droppedTotal(), sessions.size());
        }
    }

    private void sendLoop(ListenerSession session) {
        try {
            while (session.isOpen()) {
                String payload = session.nextFrame(1, TimeUnit.SECONDS);
                if (payload != null) {
                    session.sendData(payload);
                }
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE send failed. sessionId={} - {}", session.getId(), e.getMessage());
            session.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.close();
        }
    }

    private void fail(ListenerSession session) {
        meterRegistry.counter(METRIC_SESSION_FAILED).increment();
        session.sendError("subscription failed");
        session.close();
    }
}
