package com.truthlens.tracker.content;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Extracts the main readable content of a page.
 *
 * The extractor looks for the first semantic content container, strips
 * navigation and other page chrome from a copy of it, and returns an immutable
 * {@link ContentSnapshot}. The live document passed in is never modified.
 *
 * Text sent to the analysis collaborator is capped at
 * {@code maxTransmittedChars}; word count and reading time always use the full
 * text.
 */
@Slf4j
public class ContentExtractor {

    static final List<String> CONTENT_SELECTORS = List.of(
            "article", "[role=main]", "main", ".content", ".article-content",
            ".post-content", ".entry-content", "#content", ".main-content");

    static final String CHROME_SELECTOR = String.join(", ",
            "nav", "header", "footer", "aside", ".navigation", ".nav", ".menu",
            ".sidebar", ".widget", ".advertisement", ".ads", ".social-share",
            ".comments", "script", "style", "noscript");

    private static final List<String> PUBLISH_DATE_SELECTORS = List.of(
            "time[datetime]", ".publish-date", ".date", ".post-date",
            "[property=\"article:published_time\"]", "[name=\"article:published_time\"]");

    private static final List<String> AUTHOR_SELECTORS = List.of(
            "[rel=author]", ".author", ".byline", ".post-author",
            "[property=\"article:author\"]", "[name=author]");

    private static final List<String> SOCIAL_HOSTS = List.of(
            "twitter.com", "x.com", "facebook.com", "instagram.com", "linkedin.com");

    private final int maxTransmittedChars;
    private final int wordsPerMinute;

    public ContentExtractor(int maxTransmittedChars, int wordsPerMinute) {
        if (maxTransmittedChars <= 0 || wordsPerMinute <= 0) {
            throw new IllegalArgumentException("maxTransmittedChars and wordsPerMinute must be positive");
        }
        this.maxTransmittedChars = maxTransmittedChars;
        this.wordsPerMinute = wordsPerMinute;
    }

    /**
     * Parse the given HTML and capture its main content.
     *
     * @param html raw page HTML
     * @param url  page URL, used for the domain and content type detection
     * @return snapshot of the page's main content
     * @throws ContentExtractionException when the page has no usable body or the URL is malformed
     */
    public ContentSnapshot extract(String html, String url) {
        if (html == null || url == null) {
            throw new ContentExtractionException("Page HTML and URL are required");
        }

        String domain = hostOf(url);
        Document doc;
        try {
            doc = Jsoup.parse(html, url);
        } catch (RuntimeException e) {
            throw new ContentExtractionException("Failed to parse page: " + url, e);
        }
        return extract(doc, url, domain);
    }

    private ContentSnapshot extract(Document doc, String url, String domain) {
        // Step 1: locate the main content container
        Element container = findContainer(doc);
        if (container == null) {
            throw new ContentExtractionException("Page has no body: " + url);
        }

        // Step 2: strip page chrome from a detached copy
        Element copy = container.clone();
        copy.select(CHROME_SELECTOR).remove();

        String fullText = normalize(copy.text());
        int wordCount = countWords(fullText);
        String transmitted = truncate(fullText, maxTransmittedChars);

        // Step 3: metadata
        String title = doc.title().trim();
        ContentType contentType = detectContentType(doc, url, title);

        log.debug("Extracted content: url={}, type={}, words={}, chars={}",
                url, contentType, wordCount, fullText.length());

        return ContentSnapshot.builder()
                .url(url)
                .domain(domain)
                .title(title)
                .author(firstValue(doc, AUTHOR_SELECTORS))
                .publishDate(firstValue(doc, PUBLISH_DATE_SELECTORS))
                .contentType(contentType)
                .wordCount(wordCount)
                .readingTimeMinutes((wordCount + wordsPerMinute - 1) / wordsPerMinute)
                .extractedText(transmitted)
                .fullTextLength(fullText.length())
                .build();
    }

    private Element findContainer(Document doc) {
        for (String selector : CONTENT_SELECTORS) {
            Element candidate = doc.selectFirst(selector);
            if (candidate != null) {
                return candidate;
            }
        }
        return doc.body();
    }

    /**
     * Classify the page. Order matters: a news article embedding a video
     * counts as video.
     */
    ContentType detectContentType(Document doc, String url, String title) {
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        String host = hostOf(url).toLowerCase(Locale.ROOT);

        if (host.contains("youtube.com") || host.contains("youtu.be") || host.contains("vimeo.com")
                || doc.selectFirst("video") != null) {
            return ContentType.VIDEO;
        }
        if (lowerUrl.contains("podcast") || lowerUrl.contains("audio") || doc.selectFirst("audio") != null) {
            return ContentType.PODCAST;
        }
        for (String socialHost : SOCIAL_HOSTS) {
            if (host.equals(socialHost) || host.endsWith("." + socialHost)) {
                return ContentType.SOCIAL_POST;
            }
        }
        if (doc.selectFirst("article") != null
                || lowerTitle.contains("article") || lowerTitle.contains("news")
                || lowerUrl.contains("article") || lowerUrl.contains("news")) {
            return ContentType.ARTICLE;
        }
        return ContentType.WEBPAGE;
    }

    /**
     * First non-blank value among the selectors, read from {@code datetime},
     * the element text, then {@code content}.
     */
    private String firstValue(Document doc, List<String> selectors) {
        for (String selector : selectors) {
            Element element = doc.selectFirst(selector);
            if (element == null) {
                continue;
            }
            String value = element.attr("datetime");
            if (value.isBlank()) {
                value = element.text();
            }
            if (value.isBlank()) {
                value = element.attr("content");
            }
            if (!value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                throw new ContentExtractionException("URL has no host: " + url);
            }
            return host;
        } catch (IllegalArgumentException e) {
            throw new ContentExtractionException("Malformed URL: " + url, e);
        }
    }

    /**
     * Cut {@code text} to at most {@code maxChars} chars without splitting a surrogate pair.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        int end = Character.isHighSurrogate(text.charAt(maxChars - 1)) ? maxChars - 1 : maxChars;
        return text.substring(0, end);
    }

    static String normalize(String text) {
        return text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    static int countWords(String text) {
        return text.isEmpty() ? 0 : text.split(" ").length;
    }
}
