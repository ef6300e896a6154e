package com.helia.controller;

import com.helia.api.dto.ErrorResponse;
import com.helia.error.ChatException;
import com.helia.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures raised before a response starts onto {@code {code, message}} JSON bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final int MAX_MESSAGE = 300;

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ErrorResponse> handleChatException(ChatException ex, ServerHttpRequest request) {
        ErrorCode code = ex.code();
        if (code.status().is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
                    path(request), request.getMethod(), code, ex.getMessage(), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
                    path(request), request.getMethod(), code, ex.getMessage());
        }
        return json(code.status(), ErrorResponse.of(ex));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException ex, ServerHttpRequest request) {
        String message = ex.getFieldErrors().stream()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .findFirst()
                .orElse(ErrorCode.INVALID_INPUT.defaultMessage());
        return badRequest(ex, message, request);
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, ServerHttpRequest request) {
        String message = ex instanceof ServerWebInputException input ? input.getReason() : ex.getMessage();
        return badRequest(ex, message, request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, ServerHttpRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, status={}, errorMessage={}",
                path(request), request.getMethod(), ex.getStatusCode(), ex.getReason());
        return json(ex.getStatusCode(), new ErrorResponse(ex.getStatusCode().toString(), truncate(ex.getReason())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, ServerHttpRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                path(request), request.getMethod(), ex.getClass().getSimpleName(), truncate(ex.getMessage()), ex);
        return json(ErrorCode.STORAGE_ERROR.status(), new ErrorResponse("INTERNAL_ERROR", "Unexpected server error"));
    }

    private ResponseEntity<ErrorResponse> badRequest(Exception ex, String message, ServerHttpRequest request) {
        String info = StringUtils.hasText(message) ? truncate(message) : ErrorCode.INVALID_INPUT.defaultMessage();
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                path(request), request.getMethod(), ex.getClass().getSimpleName(), ErrorCode.INVALID_INPUT, info);
        return json(ErrorCode.INVALID_INPUT.status(), new ErrorResponse(ErrorCode.INVALID_INPUT.name(), info));
    }

    /** Always JSON, also for requests that only accept an event stream. */
    private static ResponseEntity<ErrorResponse> json(HttpStatusCode status, ErrorResponse body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }

    private static String path(ServerHttpRequest request) {
        return request.getPath().value();
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE);
    }
}
