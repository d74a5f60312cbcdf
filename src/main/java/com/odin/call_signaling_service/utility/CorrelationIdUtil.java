package com.odin.call_signaling_service.utility;

import java.util.UUID;

import org.slf4j.MDC;

import com.odin.call_signaling_service.constants.ApplicationConstants;

public class CorrelationIdUtil {

    private CorrelationIdUtil() {
    }

    public static String getCorrelationId() {
        return MDC.get(ApplicationConstants.CORRELATION_ID_HEADER);
    }

    public static void setCorrelationId(String correlationId) {
        MDC.put(ApplicationConstants.CORRELATION_ID_HEADER, correlationId);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Returns the current correlation id, creating and binding one if absent.
     */
    public static String getOrCreate() {
        String correlationId = getCorrelationId();
        if (correlationId == null) {
            correlationId = generateCorrelationId();
            setCorrelationId(correlationId);
        }
        return correlationId;
    }

    public static void clear() {
        MDC.remove(ApplicationConstants.CORRELATION_ID_HEADER);
    }
}
