package com.routewise.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An incoming natural-language request.
 * <p>
 * {@code chainId} groups the retries of one logical request so the fallback
 * escalator can follow a failure streak across them. A fresh request starts
 * its own chain.
 */
public record Request(
    String requestId,
    String chainId,
    String text,
    Map<String, String> context
) {

    public Request {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(text, "text");
        chainId = chainId == null || chainId.isBlank() ? requestId : chainId;
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static Request of(String text) {
        return new Request(newId(), null, text, Map.of());
    }

    public static Request of(String text, Map<String, String> context) {
        return new Request(newId(), null, text, context);
    }

    /**
     * Creates a follow-up request that continues an existing chain.
     */
    public static Request inChain(String chainId, String text, Map<String, String> context) {
        return new Request(newId(), chainId, text, context);
    }

    private static String newId() {
        return "REQ-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
