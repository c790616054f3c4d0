package com.cred.freestyle.pos.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failing API call.
 *
 * {@code retryable} tells the caller that repeating the whole call is safe and
 * may succeed (lock wait timed out, store unavailable). Finalization is
 * idempotent with respect to stock, so a retry never deducts twice.
 *
 * @author POS Team
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String message;
    private String path;
    private boolean retryable;
    private Map<String, Object> details = new LinkedHashMap<>();

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        ErrorResponse response = new ErrorResponse();
        response.setStatus(status.value());
        response.setError(error);
        response.setMessage(message);
        response.setPath(path);
        return response;
    }

    /**
     * Add additional error details.
     *
     * @param key Detail key
     * @param value Detail value, skipped when null
     * @return This ErrorResponse for method chaining
     */
    public ErrorResponse addDetail(String key, Object value) {
        if (value != null) {
            this.details.put(key, value);
        }
        return this;
    }

    public ErrorResponse markRetryable() {
        this.retryable = true;
        return this;
    }
}
