package com.edgeviewer.edgeviewer.service.camera;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Generates a moving I420 test pattern at a fixed rate, for running the viewer without a camera.
 * The pattern is a diagonal luma gradient with a bright square sliding across it and a slow
 * colour drift in the chroma planes, which gives the edge processor something to find.
 */
public class SyntheticCaptureSource implements CaptureSource {

    private static final Logger logger = LoggerFactory.getLogger(SyntheticCaptureSource.class);

    private static final int SQUARE_SIZE_DIVISOR = 4;

    private final int width;
    private final int height;
    private final double frameRate;

    private ScheduledExecutorService generator;
    private volatile KeepLatestDispatcher dispatcher;
    private long frameIndex;

    public SyntheticCaptureSource(int width, int height, double frameRate) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid synthetic frame size " + width + "x" + height);
        }
        if (frameRate <= 0) {
            throw new IllegalArgumentException("Frame rate must be positive: " + frameRate);
        }
        this.width = width;
        this.height = height;
        this.frameRate = frameRate;
    }

    @Override
    public synchronized void start(SensorFrameListener listener, Executor analysisExecutor) {
        if (generator != null) {
            throw new IllegalStateException("Synthetic capture already running");
        }

        dispatcher = new KeepLatestDispatcher(listener, analysisExecutor);
        frameIndex = 0;
        generator = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "capture-synthetic");
            t.setDaemon(true);
            return t;
        });
        long periodNanos = (long) (1_000_000_000L / frameRate);
        generator.scheduleAtFixedRate(this::emitFrame, 0, periodNanos, TimeUnit.NANOSECONDS);
        logger.info("Synthetic capture started: {}x{} @ {} fps", width, height, frameRate);
    }

    private void emitFrame() {
        try {
            dispatcher.offer(generate(width, height, frameIndex++, null));
        } catch (RuntimeException e) {
            // an exception here would cancel the schedule
            logger.warn("Failed to generate synthetic frame: {}", e.getMessage());
        }
    }

    static PlanarSensorFrame generate(int width, int height, long frameIndex, Runnable onRelease) {
        int chromaWidth = (width + 1) / 2;
        int chromaHeight = (height + 1) / 2;
        byte[] y = new byte[width * height];
        byte[] u = new byte[chromaWidth * chromaHeight];
        byte[] v = new byte[chromaWidth * chromaHeight];

        int square = Math.max(1, Math.min(width, height) / SQUARE_SIZE_DIVISOR);
        int squareX = (int) ((frameIndex * 4) % Math.max(1, width - square + 1));
        int squareY = (height - square) / 2;
        int shift = (int) (frameIndex & 0xFF);

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                boolean inSquare = col >= squareX && col < squareX + square
                        && row >= squareY && row < squareY + square;
                y[row * width + col] = (byte) (inSquare ? 235 : ((col + row + shift) & 0x7F) + 16);
            }
        }
        for (int row = 0; row < chromaHeight; row++) {
            for (int col = 0; col < chromaWidth; col++) {
                u[row * chromaWidth + col] = (byte) (128 + ((col + shift) % 64) - 32);
                v[row * chromaWidth + col] = (byte) (128 + ((row + shift) % 64) - 32);
            }
        }
        return PlanarSensorFrame.i420(width, height, y, u, v, onRelease);
    }

    @Override
    public synchronized void stop() {
        if (generator == null) {
            return;
        }
        generator.shutdownNow();
        try {
            if (!generator.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.warn("Synthetic generator did not stop within 1 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        dispatcher.clear();
        generator = null;
        logger.info("Synthetic capture stopped after {} frames", frameIndex);
    }

    @Override
    public synchronized boolean isRunning() {
        return generator != null && !generator.isShutdown();
    }

    @Override
    public long getDroppedFrames() {
        KeepLatestDispatcher current = dispatcher;
        return current != null ? current.getDroppedFrames() : 0;
    }

    @Override
    public String describe() {
        return "synthetic:" + width + "x" + height + "@" + frameRate;
    }
}
