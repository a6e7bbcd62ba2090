package com.len.courtqueue.application.notification;

/**
 * 알림 브로드캐스트 (fire-and-forget).
 *
 * 구현체는 어떤 실패도 호출자에게 던지지 않는다. 로그만 남긴다.
 * 발행 시점에 붙어있는 리스너가 없으면 그 이벤트는 그냥 사라진다.
 */
public interface NotificationPublisher {

    void broadcast(Object event);
}
