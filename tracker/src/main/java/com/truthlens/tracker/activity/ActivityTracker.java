package com.truthlens.tracker.activity;

import com.truthlens.tracker.TrackerSettings;
import com.truthlens.tracker.analysis.AnalysisProvider;
import com.truthlens.tracker.analysis.AnalysisResult;
import com.truthlens.tracker.analysis.RestAnalysisProvider;
import com.truthlens.tracker.buffer.AnalysisHistoryEntry;
import com.truthlens.tracker.buffer.LocalBuffer;
import com.truthlens.tracker.content.ContentExtractionException;
import com.truthlens.tracker.content.ContentExtractor;
import com.truthlens.tracker.content.ContentSnapshot;
import com.truthlens.tracker.scheduler.ExecutorTrackerScheduler;
import com.truthlens.tracker.scheduler.ScheduledHandle;
import com.truthlens.tracker.scheduler.TrackerScheduler;
import com.truthlens.tracker.sync.ConsumptionDraft;
import com.truthlens.tracker.sync.MonitoringApiClient;
import com.truthlens.tracker.sync.RestMonitoringApiClient;
import com.truthlens.tracker.sync.SyncException;
import com.truthlens.tracker.sync.SyncQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Client-side observer of reading behaviour.
 *
 * The host forwards page events (load, content mutation, scroll, interaction,
 * visibility, unload) to this class. Every handler is posted to the
 * {@link TrackerScheduler} event loop and returns immediately; network work
 * (analysis, sync) runs on a separate executor and never blocks the loop.
 *
 * Per page view the tracker:
 * <ul>
 *   <li>credits viewing time while the page is visible and the user interacted within the idle window</li>
 *   <li>keeps the maximum scroll depth</li>
 *   <li>requests one analysis, debounced after the page settles, if the page has enough text</li>
 *   <li>logs a consumption draft on hide or unload once enough time is pending</li>
 * </ul>
 *
 * A page whose content cannot be extracted, or whose text is too short, is
 * neither analysed nor logged.
 */
@Slf4j
public class ActivityTracker {

    private final TrackerSettings settings;
    private final ContentExtractor contentExtractor;
    private final AnalysisProvider analysisProvider;
    private final LocalBuffer localBuffer;
    private final SyncQueue syncQueue;
    private final MonitoringApiClient apiClient;
    private final TrackerScheduler scheduler;
    private final Executor networkExecutor;
    private final Clock clock;

    // loop-confined
    private PageView current;
    private ScheduledHandle tickHandle;

    public ActivityTracker(TrackerSettings settings, ContentExtractor contentExtractor,
                           AnalysisProvider analysisProvider, LocalBuffer localBuffer, SyncQueue syncQueue,
                           MonitoringApiClient apiClient, TrackerScheduler scheduler,
                           Executor networkExecutor, Clock clock) {
        this.settings = settings;
        this.contentExtractor = contentExtractor;
        this.analysisProvider = analysisProvider;
        this.localBuffer = localBuffer;
        this.syncQueue = syncQueue;
        this.apiClient = apiClient;
        this.scheduler = scheduler;
        this.networkExecutor = networkExecutor;
        this.clock = clock;
    }

    /**
     * Wire a tracker against the platform API.
     *
     * @param settings      tracker settings
     * @param tokenSupplier supplies the current bearer token for each call
     * @return a tracker that still needs {@link #start()}
     */
    public static ActivityTracker create(TrackerSettings settings, Supplier<String> tokenSupplier) {
        RestClient restClient = RestClient.builder().baseUrl(settings.getApiBaseUrl()).build();
        TrackerScheduler scheduler = new ExecutorTrackerScheduler();
        ExecutorService networkExecutor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "tracker-network");
            thread.setDaemon(true);
            return thread;
        });
        Clock clock = Clock.systemUTC();

        LocalBuffer buffer = new LocalBuffer(settings.getAnalysisHistoryCapacity(), settings.getConsumptionLogCapacity());
        MonitoringApiClient apiClient = new RestMonitoringApiClient(restClient, tokenSupplier);
        SyncQueue syncQueue = new SyncQueue(buffer, apiClient, scheduler, networkExecutor, clock,
                settings.getSyncFlushInterval(), settings.getLoggingThresholdSeconds());

        return new ActivityTracker(settings,
                new ContentExtractor(settings.getMaxTransmittedChars(), settings.getWordsPerMinute()),
                new RestAnalysisProvider(restClient, tokenSupplier),
                buffer, syncQueue, apiClient, scheduler, networkExecutor, clock);
    }

    /**
     * Arm the checkpoint tick and the sync flush, and open a server session.
     * Calling it again cancels the handles armed by the previous call first.
     */
    public void start() {
        scheduler.execute(() -> {
            cancelTick();
            tickHandle = scheduler.scheduleAtFixedRate(this::tick, settings.getTickInterval(), settings.getTickInterval());
            syncQueue.start();
            networkExecutor.execute(() -> callQuietly("start_session", apiClient::startSession));
            log.info("Activity tracker started");
        });
    }

    /**
     * Close the current page view, flush what is pending and end the server session.
     */
    public void stop() {
        scheduler.execute(() -> {
            closeCurrent(clock.instant());
            syncQueue.flushOnUnload();
            cancelTick();
            syncQueue.stop();
            networkExecutor.execute(() -> callQuietly("end_session", apiClient::endSession));
            log.info("Activity tracker stopped");
        });
    }

    /**
     * Stop tracking and release the event loop. A network executor service
     * handed to the tracker is shut down after the calls already queued on it.
     */
    public void shutdown() {
        stop();
        scheduler.execute(() -> {
            if (networkExecutor instanceof ExecutorService) {
                ((ExecutorService) networkExecutor).shutdown();
            }
            scheduler.shutdown();
        });
    }

    /**
     * A new page finished loading. Any previous page view is closed as if unloaded.
     */
    public void onPageLoaded(String url, String html) {
        scheduler.execute(() -> {
            Instant now = clock.instant();
            closeCurrent(now);
            current = new PageView(url, html, now, settings.getIdleWindow());
            armAnalysis(current);
            log.debug("Page view started: url={}", url);
        });
    }

    /**
     * The page's DOM changed. Re-arms the analysis debounce until analysis has fired.
     */
    public void onContentMutated(String html) {
        scheduler.execute(() -> {
            PageView pageView = current;
            if (pageView == null || pageView.isAnalysisRequested()) {
                return;
            }
            pageView.updateHtml(html);
            armAnalysis(pageView);
        });
    }

    /**
     * @param scrollY        vertical scroll offset
     * @param documentHeight full document height
     * @param viewportHeight visible viewport height
     */
    public void onScroll(double scrollY, double documentHeight, double viewportHeight) {
        scheduler.execute(() -> {
            if (current == null) {
                return;
            }
            double scrollable = documentHeight - viewportHeight;
            double depth = scrollable > 0 ? (scrollY / scrollable) * 100.0 : 100.0;
            current.recordScroll(clock.instant(), depth);
        });
    }

    /** Mouse movement or click. */
    public void onInteraction() {
        scheduler.execute(() -> {
            if (current != null) {
                current.recordInteraction(clock.instant());
            }
        });
    }

    public void onVisibilityChanged(boolean visible) {
        scheduler.execute(() -> {
            if (current == null) {
                return;
            }
            Instant now = clock.instant();
            if (visible) {
                current.show(now);
                return;
            }
            current.hide(now);
            buildDraft(current, now).ifPresent(syncQueue::submit);
        });
    }

    /**
     * The page is going away. Logs the page view and runs the synchronous unload flush.
     */
    public void onUnload() {
        scheduler.execute(() -> {
            closeCurrent(clock.instant());
            syncQueue.flushOnUnload();
        });
    }

    /**
     * Activity state of the current page view, read on the event loop.
     */
    public CompletableFuture<Optional<ActivitySample>> currentSample() {
        CompletableFuture<Optional<ActivitySample>> future = new CompletableFuture<>();
        scheduler.execute(() -> future.complete(
                Optional.ofNullable(current).map(pageView -> pageView.sample(clock.instant()))));
        return future;
    }

    public LocalBuffer getLocalBuffer() {
        return localBuffer;
    }

    private void tick() {
        if (current != null) {
            current.checkpoint(clock.instant());
        }
    }

    private void closeCurrent(Instant now) {
        PageView pageView = current;
        if (pageView == null) {
            return;
        }
        current = null;
        pageView.hide(now);
        pageView.close();
        buildDraft(pageView, now).ifPresent(syncQueue::enqueue);
        log.debug("Page view closed: url={}, credited={}s", pageView.url(), pageView.creditedSeconds());
    }

    private void armAnalysis(PageView pageView) {
        pageView.rearmDebounce(scheduler.schedule(() -> runAnalysis(pageView), settings.getAnalysisDebounce()));
    }

    /**
     * Debounced analysis task. Runs on the loop; the provider call itself is
     * handed to the network executor.
     */
    private void runAnalysis(PageView pageView) {
        if (pageView.isClosed() || pageView.isAnalysisRequested()) {
            return;
        }

        // Step 1: extract and qualify
        ContentSnapshot snapshot;
        try {
            snapshot = contentExtractor.extract(pageView.html(), pageView.url());
        } catch (ContentExtractionException e) {
            log.debug("Page not tracked, extraction failed: url={}, reason={}", pageView.url(), e.getMessage());
            return;
        }
        if (snapshot.getFullTextLength() < settings.getMinAnalysisChars()) {
            log.debug("Page not tracked, text too short: url={}, chars={}",
                    pageView.url(), snapshot.getFullTextLength());
            return;
        }

        // Step 2: one-shot analysis request
        pageView.snapshot(snapshot);
        pageView.markAnalysisRequested();
        CompletableFuture
                .supplyAsync(() -> analysisProvider.analyze(snapshot), networkExecutor)
                .whenComplete((result, error) ->
                        scheduler.execute(() -> onAnalysisCompleted(pageView, snapshot, result, error)));
    }

    private void onAnalysisCompleted(PageView pageView, ContentSnapshot snapshot, AnalysisResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.warn("Analysis skipped: url={}, error={}", snapshot.getUrl(), cause.getMessage());
            return;
        }
        pageView.analysis(result);
        localBuffer.recordAnalysis(AnalysisHistoryEntry.builder()
                .url(snapshot.getUrl())
                .title(snapshot.getTitle())
                .domain(snapshot.getDomain())
                .contentType(snapshot.getContentType())
                .result(result)
                .analyzedAt(clock.instant())
                .build());
        log.debug("Analysis recorded: url={}, credibility={}, bias={}",
                snapshot.getUrl(), result.getCredibilityScore(), result.getBiasScore());
    }

    /**
     * Draft for the time credited since the last draft of this page view, if it
     * exceeds the logging threshold and the page qualified for tracking.
     */
    private Optional<ConsumptionDraft> buildDraft(PageView pageView, Instant now) {
        ContentSnapshot snapshot = pageView.snapshot();
        if (snapshot == null) {
            return Optional.empty();
        }
        long pending = pageView.pendingSeconds();
        if (pending <= settings.getLoggingThresholdSeconds()) {
            return Optional.empty();
        }
        pageView.markEmitted(pending);

        AnalysisResult analysis = pageView.analysis();
        int scrollDepth = (int) Math.round(pageView.maxScrollDepth());
        return Optional.of(ConsumptionDraft.builder()
                .url(ContentExtractor.truncate(snapshot.getUrl(), ConsumptionDraft.MAX_URL_CHARS))
                .title(ContentExtractor.truncate(snapshot.getTitle(), ConsumptionDraft.MAX_TITLE_CHARS))
                .domain(snapshot.getDomain())
                .contentType(snapshot.getContentType())
                .timeSpentSeconds(pending)
                .scrollDepthPercent(scrollDepth)
                .wordCount(snapshot.getWordCount())
                .engagementScore(EngagementCalculator.score(
                        pageView.creditedSeconds(), snapshot.getReadingTimeMinutes(), pageView.maxScrollDepth()))
                .credibilityScore(analysis == null ? null : analysis.getCredibilityScore())
                .biasScore(analysis == null ? null : analysis.getBiasScore())
                .capturedAt(now)
                .build());
    }

    private void cancelTick() {
        if (tickHandle != null) {
            tickHandle.cancel();
            tickHandle = null;
        }
    }

    private void callQuietly(String operation, Runnable call) {
        try {
            call.run();
        } catch (SyncException e) {
            log.warn("Session call failed: operation={}, error={}", operation, e.getMessage());
        }
    }
}
