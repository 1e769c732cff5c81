package com.herzen.gradepipe.api;

import com.herzen.gradepipe.solver.SolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex);
    }

    @ExceptionHandler(SolverException.class)
    public ResponseEntity<Map<String, Object>> handleSolver(SolverException ex) {
        log.error("Solver run failed", ex);
        return respond(HttpStatus.BAD_GATEWAY, "solver_failed", ex);
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(UncheckedIOException ex) {
        log.error("Pipeline I/O failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "io_error", ex);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, Exception ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", ex.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
