package com.dubbi.hostmaster.common.api;

import com.dubbi.hostmaster.portal.error.ApplicationException;
import com.dubbi.hostmaster.portal.error.CredentialException;
import com.dubbi.hostmaster.portal.error.EncodingException;
import com.dubbi.hostmaster.portal.error.PortalException;
import com.dubbi.hostmaster.portal.error.PortalTimeoutException;
import com.dubbi.hostmaster.portal.error.TransportException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 포털 예외를 HTTP 응답으로 변환한다. 응답 본문은 {@code {ok:false, error, kind}} 형태다.
 */
@RestControllerAdvice
public class PortalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(PortalExceptionHandler.class);

    @ExceptionHandler(PortalException.class)
    public ResponseEntity<Map<String, Object>> handlePortal(PortalException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("[Api] portal {} failure: {}", e.kind(), e.getMessage(), e);
        } else {
            log.warn("[Api] portal {} failure: {}", e.kind(), e.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", e.getMessage());
        body.put("kind", e.kind());
        if (e instanceof ApplicationException app) {
            body.put("messages", app.getMessages());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("ok", false, "error", String.valueOf(e.getMessage()), "kind", "REQUEST"));
    }

    static HttpStatus statusOf(PortalException e) {
        if (e instanceof PortalTimeoutException) return HttpStatus.GATEWAY_TIMEOUT;
        if (e instanceof TransportException) return HttpStatus.BAD_GATEWAY;
        if (e instanceof CredentialException) return HttpStatus.INTERNAL_SERVER_ERROR;
        if (e instanceof EncodingException) return HttpStatus.BAD_REQUEST;
        if (e instanceof ApplicationException) return HttpStatus.UNPROCESSABLE_ENTITY;
        return HttpStatus.BAD_GATEWAY;
    }
}
