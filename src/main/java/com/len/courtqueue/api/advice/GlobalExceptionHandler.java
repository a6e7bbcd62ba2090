package com.len.courtqueue.api.advice;

import com.len.courtqueue.common.exception.BusinessException;
import com.len.courtqueue.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== 업무 예외 (INVALID_REQUEST / NOT_FOUND / 충돌 한도 초과) =====
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException e, HttpServletRequest req) {
        ErrorCode ec = e.getErrorCode();
        if (ec.getHttpStatus().is5xxServerError()) {
            log.error("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.getMessage());
        } else {
            log.warn("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.getMessage());
        }
        return build(ec, e.getMessage(), req);
    }

    // ===== @Valid 검증 실패 =====
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("[INVALID_REQUEST] {} {} - {}", req.getMethod(), req.getRequestURI(), message);
        return build(ErrorCode.INVALID_REQUEST, message, req);
    }

    // ===== JSON 파싱 실패 =====
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        log.warn("[INVALID_REQUEST] {} {} - unreadable body", req.getMethod(), req.getRequestURI());
        return build(ErrorCode.INVALID_REQUEST, ErrorCode.INVALID_REQUEST.getMessage(), req);
    }

    // ===== 저장소(Redis) 예외 =====
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest req) {
        log.error("[STORE_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return build(ErrorCode.STORE_ERROR, ErrorCode.STORE_ERROR.getMessage(), req);
    }

    // ===== 그 외 모든 예외 =====
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAny(Exception e, HttpServletRequest req) {
        log.error("[INTERNAL_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        ErrorCode ec = ErrorCode.INTERNAL_ERROR;
        return build(ec, ec.getMessage() + " [" + e.getClass().getSimpleName() + ": " + e.getMessage() + "]", req);
    }

    private ResponseEntity<ErrorResponse> build(ErrorCode ec, String message, HttpServletRequest req) {
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, message, req.getRequestURI()));
    }
}
