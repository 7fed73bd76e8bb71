package com.dailyprojects.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setCaller puts callerKey in MDC")
    void setCaller() {
        MdcContext.setCaller("10.0.0.1");
        assertEquals("10.0.0.1", MDC.get("callerKey"));
    }

    @Test
    @DisplayName("setBatch puts batchDate and batchCount in MDC")
    void setBatch() {
        MdcContext.setBatch(LocalDate.of(2025, 9, 13), 3);
        assertEquals("2025-09-13", MDC.get("batchDate"));
        assertEquals("3", MDC.get("batchCount"));
    }

    @Test
    @DisplayName("clearBatch keeps the caller")
    void clearBatch() {
        MdcContext.setCaller("10.0.0.1");
        MdcContext.setBatch(LocalDate.of(2025, 9, 13), 3);
        MdcContext.clearBatch();

        assertEquals("10.0.0.1", MDC.get("callerKey"));
        assertNull(MDC.get("batchDate"));
        assertNull(MDC.get("batchCount"));
    }

    @Test
    @DisplayName("clear removes all keys")
    void clear() {
        MdcContext.setCaller("10.0.0.1");
        MdcContext.setBatch(LocalDate.of(2025, 9, 13), 3);
        MdcContext.clear();

        assertNull(MDC.get("callerKey"));
        assertNull(MDC.get("batchDate"));
        assertNull(MDC.get("batchCount"));
    }
}
