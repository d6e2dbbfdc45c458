package com.phonepe.agentrecall.core.model;

/**
 * Where a memory originally came from
 */
public enum SourceType {
    USER_INPUT,
    TOOL_OUTPUT,
    WEB_SCRAPE,
    AGENT_INFERENCE,
    EXTERNAL,
    SYSTEM,
    ;

    /**
     * Collapses the source type into the four trust buckets used at ingestion time.
     */
    public SourceType canonical() {
        return switch (this) {
            case USER_INPUT -> USER_INPUT;
            case TOOL_OUTPUT -> TOOL_OUTPUT;
            case WEB_SCRAPE, EXTERNAL -> WEB_SCRAPE;
            case AGENT_INFERENCE, SYSTEM -> SYSTEM;
        };
    }
}
