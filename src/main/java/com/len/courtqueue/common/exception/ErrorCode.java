package com.len.courtqueue.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다."),
    STORE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_ERROR", "대기열 저장소 오류가 발생했습니다."),

    // 코트
    COURT_NOT_FOUND(HttpStatus.NOT_FOUND, "COURT_NOT_FOUND", "코트가 존재하지 않습니다."),

    // 대기열 관련
    QUEUE_NOT_FOUND(HttpStatus.NOT_FOUND, "QUEUE_NOT_FOUND", "해당 코트의 대기열이 없습니다."),
    QUEUE_UPDATE_CONFLICT(HttpStatus.INTERNAL_SERVER_ERROR, "QUEUE_UPDATE_CONFLICT", "동시 요청이 많아 대기열 갱신에 실패했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
