package com.truthlens.tracker.content;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ContentExtractor.
 *
 * Covers container selection, chrome stripping, truncation, metadata and
 * content type detection.
 */
@DisplayName("ContentExtractor Unit Tests")
class ContentExtractorTest {

    private ContentExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ContentExtractor(5000, 200);
    }

    @Test
    @DisplayName("Main container is preferred over body and page chrome is stripped")
    void testExtractsArticleWithoutChrome() {
        // Arrange
        String html = """
                <html><head><title>Local election results</title></head>
                <body>
                  <nav>Home | World | Sports</nav>
                  <div class="sidebar">Trending now</div>
                  <article>
                    <h1>Turnout hits record</h1>
                    <p>Voters turned out in record numbers.</p>
                    <div class="social-share">Share this</div>
                    <script>track();</script>
                  </article>
                  <footer>Copyright</footer>
                </body></html>
                """;

        // Act
        ContentSnapshot snapshot = extractor.extract(html, "https://news.example.com/2024/election");

        // Assert
        assertEquals("Turnout hits record Voters turned out in record numbers.", snapshot.getExtractedText());
        assertEquals("news.example.com", snapshot.getDomain());
        assertEquals("Local election results", snapshot.getTitle());
        assertEquals(ContentType.ARTICLE, snapshot.getContentType());
        assertEquals(9, snapshot.getWordCount());
        assertEquals(1, snapshot.getReadingTimeMinutes());
    }

    @Test
    @DisplayName("Body is used when no semantic container exists")
    void testFallsBackToBody() {
        String html = "<html><body><header>Logo</header><div><p>Plain body text here</p></div></body></html>";

        ContentSnapshot snapshot = extractor.extract(html, "https://example.com/about");

        assertEquals("Plain body text here", snapshot.getExtractedText());
        assertEquals(ContentType.WEBPAGE, snapshot.getContentType());
    }

    @Test
    @DisplayName("Long text is truncated for transmission but counted in full")
    void testTruncatesButCountsFullText() {
        // Arrange
        String body = "lorem ".repeat(1500);
        String html = "<html><body><main><p>" + body + "</p></main></body></html>";

        // Act
        ContentSnapshot snapshot = extractor.extract(html, "https://example.com/long");

        // Assert
        assertEquals(5000, snapshot.getExtractedText().length());
        assertEquals(1500 * 6 - 1, snapshot.getFullTextLength());
        assertEquals(1500, snapshot.getWordCount());
        assertEquals(8, snapshot.getReadingTimeMinutes());
        assertTrue(snapshot.isTruncated());
    }

    @Test
    @DisplayName("Truncation never splits a surrogate pair")
    void testTruncationKeepsSurrogatePairsWhole() {
        // Arrange
        String body = "a".repeat(4999) + "\uD83C\uDF0A tail";
        String html = "<html><body><main><p>" + body + "</p></main></body></html>";

        // Act
        ContentSnapshot snapshot = extractor.extract(html, "https://example.com/emoji");

        // Assert
        String text = snapshot.getExtractedText();
        assertEquals(4999, text.length());
        assertFalse(Character.isHighSurrogate(text.charAt(text.length() - 1)));
        assertTrue(snapshot.isTruncated());
    }

    @Test
    @DisplayName("Truncate keeps short text and cuts long text at the limit")
    void testTruncateHelper() {
        assertNull(ContentExtractor.truncate(null, 10));
        assertEquals("short", ContentExtractor.truncate("short", 10));
        assertEquals("abc", ContentExtractor.truncate("abcdef", 3));
        assertEquals("ab", ContentExtractor.truncate("ab\uD83D\uDE00", 3));
    }

    @Test
    @DisplayName("Author and publish date are read from the first matching selector")
    void testExtractsAuthorAndPublishDate() {
        String html = """
                <html><body><article>
                  <a rel="author" href="/staff/jane">Jane Doe</a>
                  <time datetime="2024-05-01T10:00:00Z">May 1</time>
                  <p>Body</p>
                </article></body></html>
                """;

        ContentSnapshot snapshot = extractor.extract(html, "https://example.com/story");

        assertEquals("Jane Doe", snapshot.getAuthor());
        assertEquals("2024-05-01T10:00:00Z", snapshot.getPublishDate());
    }

    @Test
    @DisplayName("Publish date falls back to the article:published_time meta tag")
    void testPublishDateFromMeta() {
        String html = """
                <html><head><meta property="article:published_time" content="2024-05-02"></head>
                <body><p>Body</p></body></html>
                """;

        ContentSnapshot snapshot = extractor.extract(html, "https://example.com/page");

        assertEquals("2024-05-02", snapshot.getPublishDate());
        assertNull(snapshot.getAuthor());
    }

    @Test
    @DisplayName("Video hosts and video elements are classified as video")
    void testDetectsVideo() {
        String html = "<html><body><p>Watch</p></body></html>";

        assertEquals(ContentType.VIDEO,
                extractor.extract(html, "https://www.youtube.com/watch?v=abc").getContentType());
        assertEquals(ContentType.VIDEO,
                extractor.extract("<html><body><video src='a.mp4'></video></body></html>",
                        "https://example.com/clip").getContentType());
    }

    @Test
    @DisplayName("Audio pages are podcasts and social hosts are social posts")
    void testDetectsPodcastAndSocial() {
        String html = "<html><body><p>Episode</p></body></html>";

        assertEquals(ContentType.PODCAST,
                extractor.extract(html, "https://example.com/podcast/ep-12").getContentType());
        assertEquals(ContentType.PODCAST,
                extractor.extract("<html><body><audio src='a.mp3'></audio></body></html>",
                        "https://example.com/ep").getContentType());
        assertEquals(ContentType.SOCIAL_POST,
                extractor.extract(html, "https://twitter.com/someone/status/1").getContentType());
    }

    @Test
    @DisplayName("Malformed or missing input raises ContentExtractionException")
    void testMalformedInput() {
        assertThrows(ContentExtractionException.class,
                () -> extractor.extract("<html></html>", "not a url"));
        assertThrows(ContentExtractionException.class,
                () -> extractor.extract(null, "https://example.com"));
    }
}
