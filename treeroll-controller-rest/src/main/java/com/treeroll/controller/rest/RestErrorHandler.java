package com.treeroll.controller.rest;

import com.treeroll.service.core.fact.FactSchemaException;
import com.treeroll.service.core.hierarchy.HierarchyConfigurationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/** Maps configuration, schema, validation and request errors to 400 responses. */
@ControllerAdvice
public class RestErrorHandler {

    @ExceptionHandler(HierarchyConfigurationException.class)
    public ResponseEntity<ErrorPayload> handleHierarchy(HierarchyConfigurationException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid hierarchy configuration", ex.problems(), request);
    }

    @ExceptionHandler(FactSchemaException.class)
    public ResponseEntity<ErrorPayload> handleSchema(FactSchemaException ex, WebRequest request) {
        List<String> details = new ArrayList<>();
        ex.missingDimensions().forEach(column -> details.add("missing dimension column: " + column));
        ex.missingMeasures().forEach(column -> details.add("missing measure column: " + column));
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), details, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleInvalid(MethodArgumentNotValidException ex, WebRequest request) {
        List<String> details = new ArrayList<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            details.add(error.getField() + ": " + error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "Invalid request body", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", List.of(), request);
    }

    private ResponseEntity<ErrorPayload> build(
            HttpStatus status, String message, List<String> details, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body =
                new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path, details);
        return ResponseEntity.status(status).body(body);
    }
}
