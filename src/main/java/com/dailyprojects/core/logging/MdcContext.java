package com.dailyprojects.core.logging;

import org.slf4j.MDC;

import java.time.LocalDate;

/**
 * Utility for managing request-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CALLER_KEY = "callerKey";
    public static final String BATCH_DATE = "batchDate";
    public static final String BATCH_COUNT = "batchCount";

    private MdcContext() {}

    public static void setCaller(String callerKey) {
        MDC.put(CALLER_KEY, callerKey);
    }

    public static void setBatch(LocalDate date, int count) {
        MDC.put(BATCH_DATE, date.toString());
        MDC.put(BATCH_COUNT, String.valueOf(count));
    }

    public static void clearBatch() {
        MDC.remove(BATCH_DATE);
        MDC.remove(BATCH_COUNT);
    }

    public static void clear() {
        MDC.remove(CALLER_KEY);
        clearBatch();
    }
}
