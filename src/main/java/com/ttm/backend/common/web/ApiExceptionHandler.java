package com.ttm.backend.common.web;

import com.ttm.backend.pr.program.ProgramApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * 統一錯誤格式 {code, message}：
 * - 400：@Valid 失敗 / body 讀不到 / IllegalArgument
 * - 502：課表 API 失敗（不吞掉，不然會拿空課表亂配對）
 * - 500：其他未預期錯誤
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("VALIDATION_FAILED", msg));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", "REQUEST_BODY_UNREADABLE"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage()));
    }

    // ===== 502 Bad Gateway =====

    @ExceptionHandler(ProgramApiException.class)
    public ResponseEntity<Map<String, Object>> handleProgramApi(ProgramApiException ex) {
        log.warn("program_api failed status={} code={} body={}", ex.getStatus(), ex.getMessage(), ex.getBodySnippet());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(err("PROGRAM_API_FAILED", ex.getMessage()));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex) {
        log.error("unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", ex.getMessage()));
    }

    private static Map<String, Object> err(String code, String message) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        return m;
    }
}
