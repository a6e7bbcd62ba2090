package com.len.courtqueue.application.queue;

/**
 * join / leave 결과.
 * accepted=false 는 오류가 아니라 "이미 대기 중", "대기열에 없음" 같은 정상 업무 응답이다.
 */
public record QueueActionResult(
        boolean accepted,
        String message,
        int position,
        int estimatedWait     // 분
) {}
