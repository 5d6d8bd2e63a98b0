package com.ftsquery.query;

public record TransformResult(
        String query,
        String condition,
        boolean empty
) {
}
