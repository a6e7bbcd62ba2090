package com.len.courtqueue.api.notification;

import com.len.courtqueue.infra.sse.NotificationBridge;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/notifications")
public class NotificationStreamController {

    private final NotificationBridge bridge;

    public NotificationStreamController(NotificationBridge bridge) {
        this.bridge = bridge;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return bridge.open();
    }
}
