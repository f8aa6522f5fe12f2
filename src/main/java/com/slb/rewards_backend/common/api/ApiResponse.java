package com.slb.rewards_backend.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.rewards_backend.common.trace.TraceIdHolder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 统一响应封装结构 / Unified API response envelope.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应结构，所有接口（成功或异常）均返回该结构 / Unified response envelope used by all APIs.")
public class ApiResponse<T> {

    @Schema(description = "业务状态码，0 表示成功，非 0 表示业务或系统错误；通常与 HTTP 状态码含义保持一致。/ Business status code, 0 means success.", example = "0")
    private int code;

    @Schema(description = "提示信息；成功时为 'ok'，失败时为具体错误原因。/ Human readable message.", example = "ok")
    private String message;

    @Schema(description = "业务数据载体，类型由各接口的泛型 T 决定。/ Business payload.", nullable = true)
    private T data;

    @Schema(description = "请求链路追踪 ID，用于排查问题。/ Trace identifier for request correlation.", example = "b3f7e6c9a1d24c31")
    private String traceId;

    @Schema(description = "错误扩展信息（可选）。/ Optional structured error details.", nullable = true)
    private ErrorBody error;

    private ApiResponse(int code, String message, T data, String traceId) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.traceId = traceId;
        this.error = null;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(0, "ok", data, TraceIdHolder.require());
    }

    public static ApiResponse<Void> ok() {
        return ok(null);
    }

    public static <T> ApiResponse<T> of(int code, String message, T data) {
        return new ApiResponse<>(code, message, data, TraceIdHolder.require());
    }

    public static ApiResponse<Void> error(int code, String message) {
        return of(code, message, null);
    }

    /**
     * 带机器码与字段级错误明细的错误返回（参数校验、可重试错误等）。
     */
    public static ApiResponse<Void> error(int code, String message, String machineCode, Map<String, String> errors) {
        ApiResponse<Void> resp = error(code, message);
        resp.setError(new ErrorBody(machineCode, errors, null));
        return resp;
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "错误扩展结构 / Structured error details.")
    public static class ErrorBody {
        @Schema(description = "稳定机器错误码 / Stable machine-readable error code.", example = "STORE_UNAVAILABLE")
        private String code;

        @Schema(description = "字段级错误明细（可选）/ Field-level errors (optional).", nullable = true)
        private Map<String, String> errors;

        @Schema(description = "是否可重试 / Whether the caller may retry the whole operation.", nullable = true)
        private Boolean retryable;

        public ErrorBody(String code, Map<String, String> errors, Boolean retryable) {
            this.code = code;
            this.errors = errors;
            this.retryable = retryable;
        }
    }
}
