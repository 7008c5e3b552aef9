package com.routewise.core.model;

/**
 * Broad capability class a provider belongs to. The selector resolves a
 * request's complexity to one of these before picking a concrete provider.
 */
public enum ProviderCategory {
    /** Lightweight single-shot text generation. */
    GENERATION,
    /** Search-augmented answering over fresh information. */
    SEARCH,
    /** Multi-step or sequential reasoning engines. */
    REASONING,
    /** Code and tool execution. */
    EXECUTION
}
