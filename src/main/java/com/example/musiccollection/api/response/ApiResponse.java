package com.example.musiccollection.api.response;

import com.example.musiccollection.common.exception.BusinessException;
import com.example.musiccollection.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * Envelope for every API response. {@code code} is {@code "0"} on success and the HTTP status
 * otherwise; {@code requestId} matches the {@code X-Request-Id} header and the access log line.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String requestId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null, currentRequestId());
    }

    public static <T> ApiResponse<T> fail(HttpStatus status, String message) {
        return fail(status, message, null);
    }

    public static <T> ApiResponse<T> fail(HttpStatus status, String message, String userAction) {
        return new ApiResponse<>(String.valueOf(status.value()), message, null, userAction, currentRequestId());
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return fail(e.getStatus(), e.getMessage(), e.getUserAction());
    }

    private static String currentRequestId() {
        return MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }
}
