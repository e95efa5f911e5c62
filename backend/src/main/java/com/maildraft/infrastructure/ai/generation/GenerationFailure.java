package com.maildraft.infrastructure.ai.generation;

/**
 * Classified generation failure.
 *
 * @param code          stable short code for logs and reason codes
 * @param transientFailure true when a later attempt may succeed
 * @param statusCode    HTTP status when the service answered, otherwise null
 * @param shortMessage  truncated message, safe to log
 */
public record GenerationFailure(String code, boolean transientFailure, Integer statusCode, String shortMessage) {}
