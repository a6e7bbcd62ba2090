package com.len.courtqueue.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 알림 토픽 + 알림 경로 전용 스레드 풀.
 *
 * 토픽 설계:
 * - 파티션 1개: 브로드캐스트 순서 유지
 * - 짧은 보관 기간: 라이브 전달용, 재생(replay) 목적 아님
 */
@Slf4j
@Configuration
public class NotificationConfig {

    @Bean
    public NewTopic notificationTopic(
            @Value("${courtqueue.notification.topic:court-queue.notifications}") String topic
    ) {
        return TopicBuilder.name(topic)
                .partitions(1)
                .replicas(1)
                .config("retention.ms", "3600000")  // 1시간
                .config("cleanup.policy", "delete")
                .build();
    }

    /**
     * broadcast 전용. join/leave 요청 스레드가 Kafka 메타데이터 대기에 묶이지 않게 한다.
     * 큐가 가득 차면 거절(TaskRejectedException) -> 발행 측에서 로그만 남기고 버림
     */
    @Bean(name = "notificationPublishExecutor")
    public ThreadPoolTaskExecutor notificationPublishExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("notify-pub-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    /**
     * SSE 세션마다 poll 루프 1개 + 전송 루프 1개가 떠 있으므로 고정 크기 풀은 쓰지 않는다.
     */
    @Bean(name = "notificationRelayExecutor", destroyMethod = "shutdownNow")
    public ExecutorService notificationRelayExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("sse-relay-"));
    }
}
