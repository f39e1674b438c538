package com.backlogstore.core.model;

/**
 * A parsed task together with the exact text it was parsed from and that
 * text's state token. Callers pass the token back on their next write.
 */
public record TaskSnapshot(Task task, String content, String token) {
}
