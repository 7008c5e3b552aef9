package com.routewise.core.logging;

import com.routewise.core.model.Request;
import org.slf4j.MDC;

/**
 * Utility for managing Routewise-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(Request request) {
        MDC.put("requestId", request.requestId());
        MDC.put("chainId", request.chainId());
    }

    public static void setChain(String chainId) {
        MDC.put("chainId", chainId);
    }

    public static void setPlan(Request request, String planId) {
        setRequest(request);
        MDC.put("planId", planId);
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("chainId");
        MDC.remove("planId");
    }
}
