package com.len.courtqueue.infra.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.len.courtqueue.application.notification.QueueNotification;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class KafkaNotificationPublisherTest {

    private static final String TOPIC = "court-queue.notifications";

    @Mock
    KafkaTemplate<String, String> kafkaTemplate;

    SimpleMeterRegistry meterRegistry;
    ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private KafkaNotificationPublisher publisher(Executor executor) {
        return new KafkaNotificationPublisher(kafkaTemplate, objectMapper, executor, meterRegistry, TOPIC);
    }

    private double count(String result) {
        var counter = meterRegistry.find(KafkaNotificationPublisher.METRIC_PUBLISH).tag("result", result).counter();
        return counter == null ? 0 : counter.count();
    }

    private QueueNotification sample() {
        return QueueNotification.joined("court-1", "Center Court", "A", "Alice", 1, 1,
                Instant.parse("2026-03-01T09:00:00Z"));
    }

    @Test
    @DisplayName("이벤트를 JSON 으로 직렬화해 키 없이 토픽에 보낸다")
    void broadcast_sendsJson() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        given(kafkaTemplate.send(eq(TOPIC), anyString())).willReturn(
                CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(TOPIC, "x"), metadata)));

        publisher(Runnable::run).broadcast(sample());

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), payload.capture());
        assertThat(payload.getValue())
                .contains("\"type\":\"QUEUE_JOINED\"")
                .contains("\"resourceId\":\"court-1\"")
                .contains("\"occurredAt\":\"2026-03-01T09:00:00Z\"");
        assertThat(count("published")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("send 가 바로 예외를 던져도 호출자에게 전파되지 않는다")
    void broadcast_sendThrows_swallowed() {
        given(kafkaTemplate.send(eq(TOPIC), anyString())).willThrow(new IllegalStateException("producer closed"));

        assertThatCode(() -> publisher(Runnable::run).broadcast(sample())).doesNotThrowAnyException();
        assertThat(count("failed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("비동기 전송 실패도 로그/메트릭으로만 남는다")
    void broadcast_asyncFailure_counted() {
        given(kafkaTemplate.send(eq(TOPIC), anyString()))
                .willReturn(CompletableFuture.failedFuture(new RuntimeException("timeout")));

        assertThatCode(() -> publisher(Runnable::run).broadcast(sample())).doesNotThrowAnyException();
        assertThat(count("failed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("executor 가 거절하면 버리고 끝 (전송 시도 없음)")
    void broadcast_rejected_dropped() {
        Executor rejecting = task -> {
            throw new TaskRejectedException("queue full");
        };

        assertThatCode(() -> publisher(rejecting).broadcast(sample())).doesNotThrowAnyException();
        assertThat(count("rejected")).isEqualTo(1.0);
        verify(kafkaTemplate, never()).send(anyString(), anyString());
    }

    @Test
    @DisplayName("직렬화할 수 없는 이벤트는 버린다")
    void broadcast_unserializable_dropped() {
        assertThatCode(() -> publisher(Runnable::run).broadcast(new Object())).doesNotThrowAnyException();
        assertThat(count("invalid_payload")).isEqualTo(1.0);
        verify(kafkaTemplate, never()).send(anyString(), anyString());
    }
}
