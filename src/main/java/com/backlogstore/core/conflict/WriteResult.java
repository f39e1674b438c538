package com.backlogstore.core.conflict;

/**
 * What a checked write persisted, and the token callers use for their next write.
 */
public record WriteResult(String content, String token) {
}
