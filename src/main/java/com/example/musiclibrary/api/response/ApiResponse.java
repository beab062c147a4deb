package com.example.musiclibrary.api.response;

import com.example.musiclibrary.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String CODE_OK = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(CODE_OK, "OK", data, null, currentTraceId());
    }

    public static ApiResponse<Void> accepted(String message) {
        return new ApiResponse<>(CODE_OK, message, null, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return fail(code, message, null);
    }

    public static <T> ApiResponse<T> fail(String code, String message, String userAction) {
        return new ApiResponse<>(code, message, null, userAction, currentTraceId());
    }

    private static String currentTraceId() {
        return MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }
}
