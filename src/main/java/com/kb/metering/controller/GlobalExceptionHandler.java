package com.kb.metering.controller;

import com.kb.metering.exception.ErrorCode;
import com.kb.metering.exception.MeteringException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 글로벌 예외 처리 핸들러
 * 도메인 예외는 ErrorCode 의 HTTP 상태와 코드로 응답
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 과금 도메인 예외 처리 (잔액 부족, 참여자 아님, 세션 없음 등)
     *
     * @param ex 도메인 예외
     * @return 에러 응답
     */
    @ExceptionHandler(MeteringException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleMeteringException(MeteringException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        log.warn("도메인 예외: code={}, message={}", errorCode, ex.getMessage());

        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("error", errorCode.name());
        errorResponse.put("message", ex.getMessage());
        errorResponse.putAll(ex.getDetails());
        errorResponse.put("timestamp", Instant.now().toString());

        return Mono.just(ResponseEntity.status(errorCode.getStatus()).body(errorResponse));
    }

    /**
     * 유효성 검증 실패 예외 처리
     *
     * @param ex 유효성 검증 예외
     * @return 에러 응답
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(WebExchangeBindException ex) {
        log.warn("유효성 검증 실패: {}", ex.getMessage());

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach((FieldError error) -> fieldErrors.put(error.getField(), error.getDefaultMessage()));

        Map<String, Object> errorResponse = Map.of(
                "error", ErrorCode.INVALID_REQUEST.name(),
                "message", "입력값 유효성 검증에 실패했습니다",
                "fieldErrors", fieldErrors,
                "timestamp", Instant.now().toString()
        );

        return Mono.just(ResponseEntity.badRequest().body(errorResponse));
    }

    /**
     * 헤더 누락, 본문 파싱 실패 등 요청 형식 오류
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInputException(ServerWebInputException ex) {
        log.warn("잘못된 요청 형식: {}", ex.getReason());
        return Mono.just(ResponseEntity.badRequest().body(badRequest(String.valueOf(ex.getReason()))));
    }

    /**
     * IllegalArgumentException 처리
     *
     * @param ex 잘못된 인수 예외
     * @return 에러 응답
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("잘못된 인수: {}", ex.getMessage());
        return Mono.just(ResponseEntity.badRequest().body(badRequest(ex.getMessage())));
    }

    /**
     * 모든 예외에 대한 기본 처리
     *
     * @param ex 예외
     * @return 에러 응답
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleGenericException(Exception ex) {
        log.error("예상치 못한 예외 발생: {}", ex.getMessage(), ex);

        Map<String, Object> errorResponse = Map.of(
                "error", "INTERNAL_ERROR",
                "message", "서버 내부 오류가 발생했습니다",
                "timestamp", Instant.now().toString()
        );

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse));
    }

    private Map<String, Object> badRequest(String details) {
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("error", ErrorCode.INVALID_REQUEST.name());
        errorResponse.put("message", ErrorCode.INVALID_REQUEST.getDefaultMessage());
        errorResponse.put("details", details);
        errorResponse.put("timestamp", Instant.now().toString());
        return errorResponse;
    }
}
