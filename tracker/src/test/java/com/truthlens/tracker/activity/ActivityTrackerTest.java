package com.truthlens.tracker.activity;

import com.truthlens.tracker.ManualTrackerScheduler;
import com.truthlens.tracker.MutableClock;
import com.truthlens.tracker.RecordingApiClient;
import com.truthlens.tracker.TrackerSettings;
import com.truthlens.tracker.analysis.AnalysisException;
import com.truthlens.tracker.analysis.AnalysisProvider;
import com.truthlens.tracker.analysis.AnalysisResult;
import com.truthlens.tracker.buffer.LocalBuffer;
import com.truthlens.tracker.content.ContentExtractor;
import com.truthlens.tracker.content.ContentType;
import com.truthlens.tracker.sync.ConsumptionDraft;
import com.truthlens.tracker.sync.SyncQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ActivityTracker.
 *
 * The tracker runs on a virtual-time scheduler with an inline network
 * executor, so every event and timer fires deterministically.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ActivityTracker Unit Tests")
class ActivityTrackerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final String URL = "https://news.example.com/science/ocean-heat";
    private static final String ARTICLE_HTML = """
            <html><head><title>Ocean heat reaches new high</title></head>
            <body><nav>Menu</nav><article>
              <h1>Ocean heat reaches new high</h1>
              <p>Researchers measured the upper two kilometres of the ocean and found that heat content
              rose again last year, continuing a trend observed for several decades.</p>
            </article></body></html>
            """;
    private static final String SHORT_HTML =
            "<html><head><title>Login</title></head><body><main><p>Sign in to continue</p></main></body></html>";

    @Mock
    private AnalysisProvider analysisProvider;

    private MutableClock clock;
    private ManualTrackerScheduler scheduler;
    private RecordingApiClient apiClient;
    private LocalBuffer localBuffer;
    private ActivityTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        scheduler = new ManualTrackerScheduler(clock);
        apiClient = new RecordingApiClient();
        TrackerSettings settings = TrackerSettings.builder().build();
        localBuffer = new LocalBuffer(settings.getAnalysisHistoryCapacity(), settings.getConsumptionLogCapacity());
        Executor inline = Runnable::run;
        SyncQueue syncQueue = new SyncQueue(localBuffer, apiClient, scheduler, inline, clock,
                settings.getSyncFlushInterval(), settings.getLoggingThresholdSeconds());

        tracker = new ActivityTracker(settings,
                new ContentExtractor(settings.getMaxTransmittedChars(), settings.getWordsPerMinute()),
                analysisProvider, localBuffer, syncQueue, apiClient, scheduler, inline, clock);

        lenient().when(analysisProvider.analyze(any())).thenReturn(AnalysisResult.builder()
                .credibilityScore(0.82)
                .biasScore(0.21)
                .biasDetected(false)
                .build());
    }

    @Test
    @DisplayName("Short page is neither analysed nor logged")
    void testShortPageIsNotTracked() {
        // Arrange
        tracker.start();
        tracker.onPageLoaded("https://example.com/login", SHORT_HTML);

        // Act
        scheduler.advance(Duration.ofSeconds(3));
        tracker.onInteraction();
        scheduler.advance(Duration.ofSeconds(17));
        tracker.onVisibilityChanged(false);

        // Assert
        verify(analysisProvider, never()).analyze(any());
        assertTrue(apiClient.updates.isEmpty());
        assertTrue(localBuffer.consumptionLogs().isEmpty());
    }

    @Test
    @DisplayName("Qualified page is analysed once and logged on hide with analysis scores")
    void testQualifiedPageLoggedOnHide() {
        // Arrange
        tracker.onPageLoaded(URL, ARTICLE_HTML);
        scheduler.advance(Duration.ofSeconds(3));
        verify(analysisProvider, times(1)).analyze(any());

        // Act
        tracker.onContentMutated(ARTICLE_HTML + "<p>late comment</p>");
        scheduler.advance(Duration.ofSeconds(20));
        tracker.onVisibilityChanged(false);

        // Assert
        verify(analysisProvider, times(1)).analyze(any());
        assertEquals(1, apiClient.updates.size());
        ConsumptionDraft draft = apiClient.updates.get(0);
        assertEquals(23, draft.getTimeSpentSeconds());
        assertEquals(ContentType.ARTICLE, draft.getContentType());
        assertEquals(0.82, draft.getCredibilityScore());
        assertEquals(0.21, draft.getBiasScore());
        assertEquals("Ocean heat reaches new high", draft.getTitle());
        assertEquals(1, localBuffer.analysisHistory().size());
    }

    @Test
    @DisplayName("Content mutations re-arm the analysis debounce")
    void testDebounceRearmedByMutation() {
        tracker.onPageLoaded(URL, ARTICLE_HTML);
        scheduler.advance(Duration.ofSeconds(2));
        tracker.onContentMutated(ARTICLE_HTML);
        scheduler.advance(Duration.ofSeconds(2));

        verify(analysisProvider, never()).analyze(any());

        scheduler.advance(Duration.ofSeconds(1));
        verify(analysisProvider, times(1)).analyze(any());
    }

    @Test
    @DisplayName("Time beyond the idle window is not credited")
    void testIdleTimeNotCredited() {
        // Arrange
        tracker.start();
        tracker.onPageLoaded(URL, ARTICLE_HTML);

        // Act: no interaction for a minute
        scheduler.advance(Duration.ofSeconds(60));
        tracker.onVisibilityChanged(false);

        // Assert
        assertEquals(1, apiClient.updates.size());
        assertEquals(30, apiClient.updates.get(0).getTimeSpentSeconds());
    }

    @Test
    @DisplayName("Interaction after an idle gap resumes crediting from the interaction")
    void testInteractionResumesCredit() {
        tracker.onPageLoaded(URL, ARTICLE_HTML);
        scheduler.advance(Duration.ofSeconds(50));
        tracker.onInteraction();
        scheduler.advance(Duration.ofSeconds(10));
        tracker.onVisibilityChanged(false);

        // 30s before going idle plus 10s after the interaction
        assertEquals(40, apiClient.updates.get(0).getTimeSpentSeconds());
    }

    @Test
    @DisplayName("Hidden time is never credited and each flush emits only pending time")
    void testHiddenTimeNotCredited() {
        // Arrange
        tracker.onPageLoaded(URL, ARTICLE_HTML);
        scheduler.advance(Duration.ofSeconds(5));
        tracker.onVisibilityChanged(false);
        assertTrue(apiClient.updates.isEmpty());

        // Act
        scheduler.advance(Duration.ofSeconds(100));
        tracker.onVisibilityChanged(true);
        scheduler.advance(Duration.ofSeconds(10));
        tracker.onVisibilityChanged(false);

        tracker.onVisibilityChanged(true);
        scheduler.advance(Duration.ofSeconds(12));
        tracker.onUnload();

        // Assert
        assertEquals(2, apiClient.updates.size());
        assertEquals(15, apiClient.updates.get(0).getTimeSpentSeconds());
        assertEquals(12, apiClient.updates.get(1).getTimeSpentSeconds());
    }

    @Test
    @DisplayName("Scroll depth is a running maximum clamped to 0..100")
    void testScrollDepthRunningMaximum() {
        tracker.onPageLoaded(URL, ARTICLE_HTML);

        tracker.onScroll(500, 2000, 1000);
        tracker.onScroll(200, 2000, 1000);
        assertEquals(50.0, tracker.currentSample().join().orElseThrow().getScrollDepth(), 1e-9);

        tracker.onScroll(5000, 2000, 1000);
        assertEquals(100.0, tracker.currentSample().join().orElseThrow().getScrollDepth(), 1e-9);
    }

    @Test
    @DisplayName("Navigation resets scroll depth for the new page view")
    void testNavigationResetsScroll() {
        tracker.onPageLoaded(URL, ARTICLE_HTML);
        tracker.onScroll(900, 2000, 1000);

        tracker.onPageLoaded("https://news.example.com/other", ARTICLE_HTML);

        assertEquals(0.0, tracker.currentSample().join().orElseThrow().getScrollDepth(), 1e-9);
    }

    @Test
    @DisplayName("Analysis failure skips scores but still logs consumption")
    void testAnalysisFailureStillLogs() {
        when(analysisProvider.analyze(any())).thenThrow(new AnalysisException("provider down"));

        tracker.onPageLoaded(URL, ARTICLE_HTML);
        scheduler.advance(Duration.ofSeconds(15));
        tracker.onUnload();

        assertEquals(1, apiClient.updates.size());
        assertNull(apiClient.updates.get(0).getCredibilityScore());
        assertNull(apiClient.updates.get(0).getBiasScore());
        assertTrue(localBuffer.analysisHistory().isEmpty());
    }

    @Test
    @DisplayName("Leaving before the logging threshold logs nothing")
    void testBelowThresholdNotLogged() {
        tracker.onPageLoaded(URL, ARTICLE_HTML);
        scheduler.advance(Duration.ofSeconds(10));
        tracker.onUnload();

        assertTrue(apiClient.updates.isEmpty());
    }

    @Test
    @DisplayName("Restarting the tracker does not duplicate timers")
    void testRestartCancelsOwnedHandles() {
        tracker.start();
        tracker.start();

        // one checkpoint tick plus one sync flush
        assertEquals(2, scheduler.activePeriodicTasks());
        assertEquals(2, apiClient.starts);

        tracker.stop();
        assertEquals(0, scheduler.activePeriodicTasks());
        assertEquals(1, apiClient.ends);
    }

    @Test
    @DisplayName("Long URL and title are capped to what the server accepts")
    void testDraftFieldsCapped() {
        // Arrange
        String longUrl = URL + "?utm_source=" + "x".repeat(3000);
        String longTitle = "T".repeat(800);
        String html = ARTICLE_HTML.replace("<title>Ocean heat reaches new high</title>", "<title>" + longTitle + "</title>");

        // Act
        tracker.onPageLoaded(longUrl, html);
        scheduler.advance(Duration.ofSeconds(3));
        scheduler.advance(Duration.ofSeconds(20));
        tracker.onVisibilityChanged(false);

        // Assert
        assertEquals(1, apiClient.updates.size());
        ConsumptionDraft draft = apiClient.updates.get(0);
        assertEquals(ConsumptionDraft.MAX_URL_CHARS, draft.getUrl().length());
        assertTrue(draft.getUrl().startsWith(URL));
        assertEquals(ConsumptionDraft.MAX_TITLE_CHARS, draft.getTitle().length());
    }

    @Test
    @DisplayName("Shutdown terminates the network executor after queued session calls")
    void testShutdownReleasesNetworkExecutor() throws InterruptedException {
        // Arrange
        ExecutorService networkExecutor = Executors.newFixedThreadPool(2);
        TrackerSettings settings = TrackerSettings.builder().build();
        SyncQueue syncQueue = new SyncQueue(localBuffer, apiClient, scheduler, networkExecutor, clock,
                settings.getSyncFlushInterval(), settings.getLoggingThresholdSeconds());
        ActivityTracker owned = new ActivityTracker(settings,
                new ContentExtractor(settings.getMaxTransmittedChars(), settings.getWordsPerMinute()),
                analysisProvider, localBuffer, syncQueue, apiClient, scheduler, networkExecutor, clock);
        owned.start();

        // Act
        owned.shutdown();

        // Assert
        assertTrue(networkExecutor.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(networkExecutor.isShutdown());
        assertEquals(1, apiClient.ends);
        assertEquals(0, scheduler.activePeriodicTasks());
    }
}
