package com.example.timesheet.domain.model;

import java.util.List;

/**
 * Everything the schedule parser needs from one PDF page: the flattened page text and the
 * positioned words in a shared coordinate space.
 */
public record PageContent(
        String fullText,
        List<PositionedToken> tokens
) {

    public PageContent {
        fullText = fullText == null ? "" : fullText;
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }
}
