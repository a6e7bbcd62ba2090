package com.len.courtqueue.infra.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.courtqueue.application.notification.NotificationPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * 알림 토픽으로 fire-and-forget 발행.
 *
 * 직렬화 실패 / executor 거절 / send 예외 / 비동기 전송 실패 모두 여기서 삼키고 로그 + 메트릭만 남긴다.
 */
@Slf4j
@Component
public class KafkaNotificationPublisher implements NotificationPublisher {

    static final String METRIC_PUBLISH = "courtqueue.notification.publish";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final String topic;

    public KafkaNotificationPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Qualifier("notificationPublishExecutor") Executor executor,
            MeterRegistry meterRegistry,
            @Value("${courtqueue.notification.topic:court-queue.notifications}") String topic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.topic = topic;
    }

    @Override
    public void broadcast(Object event) {
        try {
            executor.execute(() -> send(event));
        } catch (RuntimeException e) {
            count("rejected");
            log.warn("[NOTIFY_REJECTED] topic={} - {}", topic, e.getMessage());
        }
    }

    private void send(Object event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            count("invalid_payload");
            log.warn("[NOTIFY_SERIALIZE_FAILED] eventType={}", event == null ? null : event.getClass().getSimpleName(), e);
            return;
        }

        try {
            // 키 없음: 수신자 지정 없는 fanout
            kafkaTemplate.send(topic, payload).whenComplete((result, ex) -> {
                if (ex == null) {
                    count("published");
                    log.debug("Notification published. topic={}, offset={}",
                            topic, result.getRecordMetadata().offset());
                } else {
                    count("failed");
                    log.warn("[NOTIFY_FAILED] topic={}, payload={} - {}", topic, payload, ex.getMessage());
                }
            });
        } catch (RuntimeException e) {
            count("failed");
            log.warn("[NOTIFY_FAILED] topic={}, payload={} - {}", topic, payload, e.getMessage());
        }
    }

    private void count(String result) {
        meterRegistry.counter(METRIC_PUBLISH, "result", result).increment();
    }
}
