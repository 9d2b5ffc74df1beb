package com.truthlens.tracker.content;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable capture of a page's main content.
 *
 * {@code extractedText} is truncated for transmission; {@code fullTextLength},
 * {@code wordCount} and {@code readingTimeMinutes} are computed from the
 * untruncated text.
 */
@Value
@Builder
public class ContentSnapshot {

    String url;

    String domain;

    String title;

    /** Byline when the page exposes one, otherwise null. */
    String author;

    /** Raw publish date as found on the page (ISO string or display text), otherwise null. */
    String publishDate;

    ContentType contentType;

    int wordCount;

    int readingTimeMinutes;

    String extractedText;

    int fullTextLength;

    public boolean isTruncated() {
        return extractedText.length() < fullTextLength;
    }
}
