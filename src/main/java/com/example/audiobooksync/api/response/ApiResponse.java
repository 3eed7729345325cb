package com.example.audiobooksync.api.response;

import com.example.audiobooksync.common.logging.JobMdc;
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

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null, MDC.get(JobMdc.REQUEST_ID));
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return fail(code, message, null, null);
    }

    public static <T> ApiResponse<T> fail(String code, String message, String userAction) {
        return fail(code, message, userAction, null);
    }

    public static <T> ApiResponse<T> fail(String code, String message, String userAction, T data) {
        return new ApiResponse<>(code, message, data, userAction, MDC.get(JobMdc.REQUEST_ID));
    }
}
