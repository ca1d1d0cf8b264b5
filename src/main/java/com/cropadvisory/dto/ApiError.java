package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Error body shared by the exception handler and the request guard. Clients
 * branch on {@code errorCode}; {@code message} is for humans.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    int status;
    String errorCode;
    String message;
    String path;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
    List<Violation> violations;

    /** One rejected request field or query parameter. */
    @Value
    public static class Violation {
        String field;
        Object rejectedValue;
        String reason;
    }
}
