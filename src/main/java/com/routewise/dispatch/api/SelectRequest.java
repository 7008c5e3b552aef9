package com.routewise.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/routing/select.
 *
 * @param text    natural-language request
 * @param chainId chain to continue; nullable, a fresh chain is started when absent
 * @param context free-form key/value context
 */
public record SelectRequest(
    String text,
    @JsonProperty("chain_id") String chainId,
    Map<String, String> context
) {}
