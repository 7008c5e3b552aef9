package com.routewise.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FallbackRequest(
    @JsonProperty("chain_id") String chainId,
    @JsonProperty("failed_provider_ids") List<String> failedProviderIds
) {}
