package com.slb.rewards_backend.common.exception;

/**
 * 业务异常。code 与 HTTP 状态码保持一致：
 * 400 参数错误 / 404 记录不存在 / 409 状态冲突 / 422 配置非法。
 */
public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int INVALID_CONFIG = 422;

    private final int code;

    public BizException(String message) {
        super(message);
        this.code = BAD_REQUEST;
    }

    public BizException(int code, String message) {
        super(message);
        this.code = code;
    }

    public static BizException notFound(String message) {
        return new BizException(NOT_FOUND, message);
    }

    public static BizException conflict(String message) {
        return new BizException(CONFLICT, message);
    }

    public static BizException invalidConfig(String message) {
        return new BizException(INVALID_CONFIG, message);
    }

    public int getCode() {
        return code;
    }

    public boolean isNotFound() {
        return code == NOT_FOUND;
    }
}
