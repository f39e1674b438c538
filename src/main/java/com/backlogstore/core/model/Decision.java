package com.backlogstore.core.model;

import java.nio.file.Path;

/**
 * An architecture decision record from {@code backlog/decisions}.
 * Each body section is independently editable.
 */
public record Decision(
        String id,
        String title,
        String date,
        String status,
        String context,
        String decision,
        String consequences,
        String alternatives,
        Path filePath
) {
}
