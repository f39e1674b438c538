package com.backlogstore.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A free-form document record from {@code backlog/docs}.
 */
public record Document(
        String id,
        String title,
        String type,
        String createdDate,
        String updatedDate,
        List<String> tags,
        String content,
        Path filePath
) {
}
