package com.len.courtqueue.infra.sse;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SSE 연결 1개 = 세션 1개.
 *
 * - poll 스레드가 enqueue, 전송 스레드가 nextFrame -> sendData
 * - 버퍼가 가득 차면 가장 오래된 프레임을 버린다
 * - 전송 성공 없이 maxDropped 를 넘게 버리면 느린 리스너로 보고 연결을 끊는다
 * - close() 는 여러 번 불려도 한 번만 정리한다
 */
@Slf4j
public class ListenerSession {

    @Getter
    private final String id;
    private final SseEmitter emitter;
    private final LinkedBlockingDeque<String> buffer;
    private final int maxDropped;
    private final Runnable onClose;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger droppedSinceLastSend = new AtomicInteger();
    private final AtomicInteger droppedTotal = new AtomicInteger();

    // poll 스레드 전용. 다른 스레드에서는 wakeup() 만 호출한다
    private volatile Consumer<String, String> consumer;

    public ListenerSession(String id, SseEmitter emitter, int bufferCapacity, int maxDropped, Runnable onClose) {
        this.id = id;
        this.emitter = emitter;
        this.buffer = new LinkedBlockingDeque<>(Math.max(1, bufferCapacity));
        this.maxDropped = maxDropped;
        this.onClose = onClose;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    void bind(Consumer<String, String> consumer) {
        this.consumer = consumer;
        if (closed.get()) {
            consumer.wakeup();
        }
    }

    public void enqueue(String payload) {
        if (closed.get()) return;

        while (!buffer.offerLast(payload)) {
            if (buffer.pollFirst() == null) continue;

            droppedTotal.incrementAndGet();
            if (droppedSinceLastSend.incrementAndGet() > maxDropped) {
                log.warn("[SSE_SLOW_LISTENER] sessionId={}, dropped={} - disconnecting", id, droppedTotal.get());
                close();
                return;
            }
        }
    }

    public String nextFrame(long timeout, TimeUnit unit) throws InterruptedException {
        return buffer.pollFirst(timeout, unit);
    }

    public int droppedTotal() {
        return droppedTotal.get();
    }

    /**
     * 이벤트 원문을 이름 없는 data 프레임으로 그대로 전달
     */
    public void sendData(String payload) throws IOException {
        emitter.send(SseEmitter.event().data(payload));
        droppedSinceLastSend.set(0);
    }

    /**
     * 스트림 오픈용 코멘트 프레임 (": connected")
     */
    public boolean sendComment(String comment) {
        return trySend(SseEmitter.event().comment(comment));
    }

    /**
     * keep-alive (event: ping, 빈 payload)
     */
    public boolean ping() {
        return trySend(SseEmitter.event().name("ping").data(""));
    }

    public boolean sendError(String message) {
        return trySend(SseEmitter.event().name("error").data(message));
    }

    private boolean trySend(SseEmitter.SseEventBuilder event) {
        if (closed.get()) return false;
        try {
            emitter.send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            // 클라이언트가 끊긴 건 정상 상황
            log.debug("SSE send failed. sessionId={} - {}", id, e.getMessage());
            close();
            return false;
        }
    }

    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        Consumer<String, String> c = this.consumer;
        if (c != null) {
            c.wakeup();
        }
        buffer.clear();
        onClose.run();

        try {
            emitter.complete();
        } catch (RuntimeException e) {
            log.debug("SSE complete failed. sessionId={} - {}", id, e.getMessage());
        }
    }
}
