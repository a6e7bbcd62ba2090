package com.len.courtqueue.api.queue.dto;

import com.len.courtqueue.application.queue.QueueActionResult;

public record QueueActionResponse(
        boolean success,      // false = 이미 대기 중 / 대기열에 없음 (오류 아님)
        String message,
        int position,         // leave면 0
        int estimatedWaitTime // 분
) {
    public static QueueActionResponse from(QueueActionResult result) {
        return new QueueActionResponse(
                result.accepted(),
                result.message(),
                result.position(),
                result.estimatedWait()
        );
    }
}
