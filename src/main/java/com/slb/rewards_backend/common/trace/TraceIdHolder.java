package com.slb.rewards_backend.common.trace;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Thread-local holder for per-request (or per-job) trace identifiers, mirrored into the logging MDC.
 */
public final class TraceIdHolder {
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private TraceIdHolder() {
    }

    public static void set(String traceId) {
        TRACE_ID.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    public static Optional<String> getOptional() {
        return Optional.ofNullable(TRACE_ID.get());
    }

    public static String require() {
        return getOptional().orElseGet(() -> {
            String generated = newTraceId();
            set(generated);
            return generated;
        });
    }

    /**
     * 定时任务没有请求头，按任务名生成一个前缀可辨识的 traceId。
     */
    public static String startJob(String jobName) {
        String traceId = jobName + "-" + newTraceId().substring(0, 12);
        set(traceId);
        return traceId;
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }

    static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
