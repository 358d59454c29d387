package com.example.nodelearn.controller;

import com.example.nodelearn.error.NodeLearnException;
import com.example.nodelearn.error.NodeNotFoundException;
import com.example.nodelearn.error.ParentNotFoundException;
import com.example.nodelearn.error.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NodeLearnException.class)
    public ResponseEntity<Map<String, Object>> handle(NodeLearnException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            logger.warn("Request failed with {}: {}", e.getCode(), e.getMessage());
        } else {
            logger.debug("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(e.toErrorMap());
    }

    static HttpStatus statusOf(NodeLearnException e) {
        switch (e.getKind()) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case STRUCTURAL:
                if (e instanceof NodeNotFoundException || e instanceof ParentNotFoundException
                        || e instanceof SessionNotFoundException) {
                    return HttpStatus.NOT_FOUND;
                }
                return HttpStatus.CONFLICT;
            case TRANSIENT:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case CONCURRENCY:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
