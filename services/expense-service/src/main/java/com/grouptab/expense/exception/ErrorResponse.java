package com.grouptab.expense.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.grouptab.expense.config.RequestLoggingInterceptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by the group expense API.
 *
 * <p>Carries the group and member the failed request was made for, taken from the request
 * context, so a client juggling several groups can tell which one was rejected.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Stable code clients switch on, e.g. {@code SPLIT_NEEDS_CONFIRMATION}
     */
    private String errorCode;

    private String message;

    /**
     * What the caller can do about it
     */
    private String details;

    private int status;

    private Instant timestamp;

    private String path;

    private String groupId;

    private String memberId;

    private List<FieldError> fieldErrors;

    /**
     * Payload the client needs to recover, e.g. the rescaled percentages of a split awaiting
     * confirmation
     */
    private Map<String, Object> metadata;

    private String traceId;

    /**
     * Builder pre-filled with status, code, message, path and the request context
     */
    public static ErrorResponseBuilder of(HttpStatus status, String errorCode, String message, String path) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .message(message)
                .status(status.value())
                .timestamp(Instant.now())
                .path(path)
                .groupId(MDC.get(RequestLoggingInterceptor.GROUP_ID))
                .memberId(MDC.get(RequestLoggingInterceptor.MEMBER_ID))
                .traceId(MDC.get(RequestLoggingInterceptor.TRACE_ID));
    }

    /**
     * Rejected value of a request field; amounts are reported in plain notation
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String rejectedValue;
        private String message;

        public static FieldError of(org.springframework.validation.FieldError error) {
            Object rejected = error.getRejectedValue();
            String value = rejected instanceof BigDecimal amount
                    ? amount.toPlainString()
                    : rejected != null ? rejected.toString() : null;
            return new FieldError(error.getField(), value, error.getDefaultMessage());
        }
    }
}
