package com.treeroll.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/** Structured error payload returned by REST endpoints; {@code details} lists individual problems. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorPayload(
        Instant timestamp, int status, String error, String message, String path, List<String> details) {}
