package com.len.courtqueue.infra.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * 알림 토픽의 durable 소비자 (고정 group id, offset 커밋).
 * SSE 브리지와는 독립적이다. 이 워커가 죽어 있어도 라이브 리스너가 받는 내용은 같다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "courtqueue.notification.worker.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationWorker {

    static final String METRIC_PROCESSED = "courtqueue.notification.worker.processed";

    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            topics = "${courtqueue.notification.topic:court-queue.notifications}",
            groupId = "${courtqueue.notification.worker-group:court-queue-notification-worker}"
    )
    public void onMessage(String payload) {
        try {
            JsonNode event = objectMapper.readTree(payload);
            log.info("[NOTIFICATION] type={}, resourceId={}, userId={}, message={}",
                    text(event, "type"), text(event, "resourceId"), text(event, "userId"), text(event, "message"));
            meterRegistry.counter(METRIC_PROCESSED, "format", "json").increment();
        } catch (JsonProcessingException e) {
            log.info("[NOTIFICATION_RAW] {}", payload);
            meterRegistry.counter(METRIC_PROCESSED, "format", "raw").increment();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
