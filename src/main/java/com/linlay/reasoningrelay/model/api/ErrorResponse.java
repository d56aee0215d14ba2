package com.linlay.reasoningrelay.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * OpenAI 风格的错误响应体：{@code {"error": {...}}}。
 */
public record ErrorResponse(
        Detail error
) {

    public static ErrorResponse of(int code, String type, String message) {
        return new ErrorResponse(new Detail(code, type, message, null));
    }

    public static ErrorResponse invalidFields(int code, String message, Map<String, String> fields) {
        return new ErrorResponse(new Detail(code, "invalid_request_error", message, Map.copyOf(fields)));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Detail(
            int code,
            String type,
            String message,
            Map<String, String> fields
    ) {
    }
}
