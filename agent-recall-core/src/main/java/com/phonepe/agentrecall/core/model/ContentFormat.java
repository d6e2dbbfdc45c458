package com.phonepe.agentrecall.core.model;

/**
 * Format detected for memory content during ingestion
 */
public enum ContentFormat {
    TEXT,
    JSON,
    HTML,
    MARKDOWN,
}
