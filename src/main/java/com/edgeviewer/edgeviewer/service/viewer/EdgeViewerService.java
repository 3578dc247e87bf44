package com.edgeviewer.edgeviewer.service.viewer;

import com.edgeviewer.edgeviewer.model.dto.FrameStats;
import com.edgeviewer.edgeviewer.service.camera.CaptureException;
import com.edgeviewer.edgeviewer.service.camera.CaptureSource;
import com.edgeviewer.edgeviewer.service.camera.FrameAnalyzer;
import com.edgeviewer.edgeviewer.service.camera.FrameRecord;
import com.edgeviewer.edgeviewer.service.display.DisplayState;
import com.edgeviewer.edgeviewer.service.display.FrameStateStore;
import com.edgeviewer.edgeviewer.service.display.StatsCalculator;
import com.edgeviewer.edgeviewer.service.nativeproc.EdgeParameters;
import com.edgeviewer.edgeviewer.service.nativeproc.EdgeProcessor;
import com.edgeviewer.edgeviewer.service.render.ViewerRenderer;
import com.edgeviewer.edgeviewer.util.DurationFormatter;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Runs the camera pipeline: capture, analysis, publication, rendering and frame statistics.
 *
 * Three threads take part and never share a lock: the capture source delivers frames on the
 * {@code camera-analysis} executor, which converts, processes and publishes them; the
 * {@link com.edgeviewer.edgeviewer.service.render.RenderSurface} draws on {@code render-exec};
 * HTTP threads read statistics and flip the display mode.
 */
@Service
public class EdgeViewerService {

    private static final Logger logger = LoggerFactory.getLogger(EdgeViewerService.class);

    static final String PROCESSOR_ERROR = "Error: Edge processor not loaded. Check the logs.";
    static final String CAPTURE_ERROR = "Error: Camera initialization failed. Check the logs.";
    private static final long STOP_TIMEOUT_MS = 5000;

    private final CaptureSource captureSource;
    private final EdgeProcessor edgeProcessor;
    private final EdgeParameters edgeParameters;
    private final FrameStateStore stateStore;
    private final ViewerRenderer renderer;
    private final LongSupplier clock;

    // capture thread only
    private final StatsCalculator statsCalculator = new StatsCalculator();

    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.IDLE);
    private volatile String errorMessage;
    private volatile Double lastFps;
    private volatile FrameAnalyzer analyzer;
    private volatile Instant sessionStart;
    private boolean processorReady;
    private ExecutorService analysisExecutor;

    @Value("${edgeviewer.capture.auto-start:true}")
    private boolean autoStart;

    @Autowired
    public EdgeViewerService(CaptureSource captureSource, EdgeProcessor edgeProcessor, EdgeParameters edgeParameters,
                             FrameStateStore stateStore, ViewerRenderer renderer) {
        this(captureSource, edgeProcessor, edgeParameters, stateStore, renderer, System::nanoTime);
    }

    EdgeViewerService(CaptureSource captureSource, EdgeProcessor edgeProcessor, EdgeParameters edgeParameters,
                      FrameStateStore stateStore, ViewerRenderer renderer, LongSupplier clock) {
        this.captureSource = captureSource;
        this.edgeProcessor = edgeProcessor;
        this.edgeParameters = edgeParameters;
        this.stateStore = stateStore;
        this.renderer = renderer;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) {
            start();
        }
    }

    /**
     * Configures the edge processor (once) and binds the capture source.
     * Any failure leaves the pipeline {@link PipelineState#UNAVAILABLE} with a user-facing message.
     *
     * @return the resulting state
     */
    public synchronized PipelineState start() {
        checkCaptureAlive();
        if (state.get() == PipelineState.CAPTURING) {
            return PipelineState.CAPTURING;
        }
        errorMessage = null;

        if (!processorReady) {
            try {
                edgeProcessor.configure(edgeParameters);
                processorReady = true;
            } catch (RuntimeException | LinkageError e) {
                return fail(PROCESSOR_ERROR, "Failed to initialize edge processor", e);
            }
        }

        stateStore.reset();
        statsCalculator.reset();
        renderer.clear();
        lastFps = null;

        FrameAnalyzer sessionAnalyzer = new FrameAnalyzer(edgeProcessor, this::handleFrame, clock);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "camera-analysis");
            t.setDaemon(true);
            return t;
        });

        try {
            captureSource.start(sessionAnalyzer, executor);
        } catch (CaptureException | RuntimeException e) {
            executor.shutdownNow();
            return fail(CAPTURE_ERROR, "Failed to bind capture source " + captureSource.describe(), e);
        }

        analyzer = sessionAnalyzer;
        analysisExecutor = executor;
        sessionStart = Instant.now();
        state.set(PipelineState.CAPTURING);
        logger.info("Capture started: {}", captureSource.describe());
        return PipelineState.CAPTURING;
    }

    private void endSession() {
        captureSource.stop();
        analysisExecutor.shutdown();
        try {
            if (!analysisExecutor.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.warn("Frame analysis did not finish within {} ms, interrupting", STOP_TIMEOUT_MS);
                analysisExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            analysisExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        analysisExecutor = null;
    }

    /**
     * Ends a session whose capture source stopped on its own (stalled input, grab error).
     */
    private synchronized void checkCaptureAlive() {
        if (state.get() != PipelineState.CAPTURING || captureSource.isRunning()) {
            return;
        }
        logger.error("Capture source {} stopped during the session", captureSource.describe());
        endSession();
        errorMessage = CAPTURE_ERROR;
        state.set(PipelineState.UNAVAILABLE);
    }

    private PipelineState fail(String userMessage, String logMessage, Throwable cause) {
        logger.error(logMessage, cause);
        errorMessage = userMessage;
        state.set(PipelineState.UNAVAILABLE);
        return PipelineState.UNAVAILABLE;
    }

    // camera-analysis thread
    private void handleFrame(FrameRecord record) {
        stateStore.publish(record);
        statsCalculator.update(record.getTimestampNs()).ifPresent(fps -> lastFps = fps);
        renderer.renderLatestFrame();
    }

    /**
     * Stops capture and waits for the frame in flight, so no sensor frame stays held.
     * Safe when no frame ever arrived.
     *
     * @return session statistics, or null when nothing was capturing
     */
    public synchronized Map<String, Object> stop() {
        if (state.get() != PipelineState.CAPTURING) {
            return null;
        }

        endSession();
        state.set(PipelineState.IDLE);

        Map<String, Object> stats = counters();
        stats.put("duration", DurationFormatter.humanize(Duration.between(sessionStart, Instant.now())));
        logger.info("Capture stopped: {}", stats);
        return stats;
    }

    /**
     * @throws IllegalStateException when not capturing; the toggle is disabled then
     */
    public void setShowRaw(boolean showRaw) {
        PipelineState current = getState();
        if (current != PipelineState.CAPTURING) {
            throw new IllegalStateException("Display mode cannot be changed while " + current);
        }
        stateStore.setShowRaw(showRaw);
        renderer.renderLatestFrame();
        logger.debug("Display mode set to {}", showRaw ? FrameStats.MODE_RAW : FrameStats.MODE_EDGES);
    }

    public boolean isShowRaw() {
        return stateStore.isShowRaw();
    }

    /**
     * Empty until two frames have been seen in the current session.
     */
    public Optional<FrameStats> currentStats() {
        Double fps = lastFps;
        DisplayState snapshot = stateStore.snapshot();
        if (fps == null || !snapshot.hasFrame()) {
            return Optional.empty();
        }
        return Optional.of(FrameStats.builder()
                .fps(fps)
                .width(snapshot.getWidth())
                .height(snapshot.getHeight())
                .mode(snapshot.getModeLabel())
                .build());
    }

    /**
     * The last drawn frame, or empty when nothing was drawn or the render thread did not answer.
     */
    public Optional<byte[]> renderedFrame(String formatName) {
        try {
            return renderer.readRenderedFrame(formatName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Could not read rendered frame: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = counters();
        status.put("state", getState().name());
        status.put("error", errorMessage);
        status.put("showRaw", stateStore.isShowRaw());
        status.put("toggleEnabled", isToggleEnabled());
        status.put("captureSource", captureSource.describe());
        return status;
    }

    private Map<String, Object> counters() {
        Map<String, Object> counters = new HashMap<>();
        FrameAnalyzer current = analyzer;
        long analyzed = current != null ? current.getFramesAnalyzed() : 0;
        long dropped = current != null ? current.getDroppedMalformed() + current.getDroppedFailed() : 0;
        counters.put("framesAnalyzed", analyzed);
        counters.put("framesDropped", dropped + captureSource.getDroppedFrames());
        counters.put("framesRendered", renderer.getFramesRendered());
        return counters;
    }

    public PipelineState getState() {
        checkCaptureAlive();
        return state.get();
    }

    public boolean isCapturing() {
        return getState() == PipelineState.CAPTURING;
    }

    public boolean isToggleEnabled() {
        return isCapturing();
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }
}
