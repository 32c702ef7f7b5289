package com.liquidation.auctionengine.api;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

@Slf4j
@RestControllerAdvice
public class AuctionExceptionHandler {

    @ExceptionHandler(AuctionException.class)
    public ResponseEntity<Map<String, Object>> handleAuction(AuctionException e) {
        return ResponseEntity.status(statusOf(e.getError())).body(body(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletion(CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof AuctionException auctionException) {
            return handleAuction(auctionException);
        }
        if (cause instanceof TimeoutException) {
            log.warn("[API] 커맨드 응답 시간 초과");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(body("COMMAND_TIMEOUT", "Command did not complete in time"));
        }
        if (cause instanceof ArithmeticException arithmeticException) {
            return handleArithmetic(arithmeticException);
        }
        if (cause instanceof IllegalArgumentException illegalArgument) {
            return handleIllegalArgument(illegalArgument);
        }
        if (cause instanceof IllegalStateException illegalState) {
            return handleIllegalState(illegalState);
        }
        log.error("[API] 커맨드 처리 실패", cause);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", String.valueOf(cause.getMessage())));
    }

    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<Map<String, Object>> handleArithmetic(ArithmeticException e) {
        return ResponseEntity.badRequest().body(body(AuctionError.INVALID_PARAMETER.name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body(AuctionError.INVALID_PARAMETER.name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException e) {
        log.warn("[API] 외부 원장 거부: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("COLLABORATOR_REJECTED", e.getMessage()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(body(AuctionError.UNAUTHORIZED.name(), e.getMessage()));
    }

    static HttpStatus statusOf(AuctionError error) {
        return switch (error) {
            case VAULT_NOT_AUCTIONED -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case INVALID_PARAMETER -> HttpStatus.BAD_REQUEST;
            case NOT_ENOUGH_BOUGHT, LEAVES_DUST -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.CONFLICT;
        };
    }

    private static Map<String, Object> body(String error, String message) {
        return Map.of(
                "success", false,
                "error", error,
                "message", message == null ? "" : message);
    }
}
