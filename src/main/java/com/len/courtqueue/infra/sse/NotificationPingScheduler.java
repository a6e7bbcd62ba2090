package com.len.courtqueue.infra.sse;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class NotificationPingScheduler {

    private final NotificationBridge bridge;

    @Scheduled(fixedRateString = "${courtqueue.notification.heartbeat-interval-ms:25000}") // 기본 25초
    public void ping() {
        bridge.pingAll();
    }
}
