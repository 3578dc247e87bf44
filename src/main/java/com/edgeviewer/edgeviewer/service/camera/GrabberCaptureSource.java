package com.edgeviewer.edgeviewer.service.camera;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Captures from a local device or stream URL with JavaCV's {@link FFmpegFrameGrabber}.
 *
 * A dedicated grab thread reads frames as fast as the input delivers them. JavaCV reuses
 * its image buffer between grabs, so every frame is copied into an owned
 * {@link PlanarSensorFrame} before it is handed to the {@link KeepLatestDispatcher}.
 */
public class GrabberCaptureSource implements CaptureSource {

    private static final Logger logger = LoggerFactory.getLogger(GrabberCaptureSource.class);

    private static final int MAX_NULL_FRAMES = 500;
    private static final long JOIN_TIMEOUT_MS = 5000;

    private final FFmpegGrabberConfig grabberConfig;
    private final String url;
    private final Function<String, FFmpegFrameGrabber> grabberFactory;
    private final long joinTimeoutMs;
    private final AtomicInteger outstandingFrames = new AtomicInteger();

    private volatile KeepLatestDispatcher dispatcher;
    private CaptureSession session;

    public GrabberCaptureSource(FFmpegGrabberConfig grabberConfig, String url) {
        this(grabberConfig, url, FFmpegFrameGrabber::new, JOIN_TIMEOUT_MS);
    }

    GrabberCaptureSource(FFmpegGrabberConfig grabberConfig, String url,
                         Function<String, FFmpegFrameGrabber> grabberFactory, long joinTimeoutMs) {
        this.grabberConfig = grabberConfig;
        this.url = url;
        this.grabberFactory = grabberFactory;
        this.joinTimeoutMs = joinTimeoutMs;
    }

    @Override
    public synchronized void start(SensorFrameListener listener, Executor analysisExecutor) throws CaptureException {
        if (session != null) {
            throw new IllegalStateException("Capture already running for " + url);
        }

        FFmpegFrameGrabber candidate = grabberFactory.apply(url);
        try {
            grabberConfig.configureGrabber(candidate, url);
        } catch (Exception e) {
            releaseGrabber(candidate);
            throw new CaptureException("Could not open capture input " + url, e);
        }

        logger.info("Capture input opened: {} ({}x{} @ {} fps)",
                url, candidate.getImageWidth(), candidate.getImageHeight(), candidate.getFrameRate());

        KeepLatestDispatcher sessionDispatcher = new KeepLatestDispatcher(listener, analysisExecutor);
        CaptureSession started = new CaptureSession(candidate, sessionDispatcher);
        started.thread = new Thread(() -> grabLoop(started), "capture-grab");
        started.thread.setDaemon(true);

        dispatcher = sessionDispatcher;
        session = started;
        started.thread.start();
    }

    private void grabLoop(CaptureSession context) {
        int consecutiveNullFrames = 0;
        long framesGrabbed = 0;

        try {
            while (!context.shouldStop && !Thread.currentThread().isInterrupted()) {
                Frame frame = context.grabber.grabImage();

                if (frame == null || frame.image == null) {
                    consecutiveNullFrames++;
                    if (consecutiveNullFrames >= MAX_NULL_FRAMES) {
                        logger.warn("Capture input {} stalled - {} null frames", url, consecutiveNullFrames);
                        break;
                    }
                    Thread.sleep(consecutiveNullFrames < 10 ? 5 : 20);
                    continue;
                }

                consecutiveNullFrames = 0;
                framesGrabbed++;
                context.dispatcher.offer(toSensorFrame(frame));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (!context.shouldStop) {
                logger.error("Capture loop failed for {}", url, e);
            }
        } finally {
            // a stop that timed out left the grabber to this thread
            if (context.shouldStop) {
                context.releaseOnce();
            }
            logger.info("Capture loop ended for {} after {} frames", url, framesGrabbed);
        }
    }

    /**
     * Copies a grabbed I420 frame. Frames whose buffer cannot hold three planes are passed on
     * as {@link SensorFormat#UNKNOWN} and left for the listener to drop.
     */
    SensorFrame toSensorFrame(Frame frame) {
        int width = frame.imageWidth;
        int height = frame.imageHeight;
        int yStride = frame.imageStride > 0 ? frame.imageStride : width;
        int chromaStride = (yStride + 1) / 2;
        int chromaHeight = (height + 1) / 2;

        ByteBuffer source = ((ByteBuffer) frame.image[0]).duplicate();
        source.rewind();
        byte[] data = new byte[source.remaining()];
        source.get(data);

        int ySize = yStride * height;
        int chromaSize = chromaStride * chromaHeight;
        outstandingFrames.incrementAndGet();
        Runnable release = outstandingFrames::decrementAndGet;

        if (frame.imageDepth != Frame.DEPTH_UBYTE || data.length < ySize + 2 * chromaSize) {
            return new PlanarSensorFrame(SensorFormat.UNKNOWN, width, height, new SensorFrame.Plane[0], release);
        }

        SensorFrame.Plane[] planes = {
                new SensorFrame.Plane(ByteBuffer.wrap(data, 0, ySize).slice(), yStride, 1),
                new SensorFrame.Plane(ByteBuffer.wrap(data, ySize, chromaSize).slice(), chromaStride, 1),
                new SensorFrame.Plane(ByteBuffer.wrap(data, ySize + chromaSize, chromaSize).slice(), chromaStride, 1)
        };
        return new PlanarSensorFrame(SensorFormat.YUV_420_888, width, height, planes, release);
    }

    @Override
    public synchronized void stop() {
        CaptureSession context = session;
        if (context == null) {
            return;
        }
        session = null;

        context.shouldStop = true;
        context.thread.interrupt();
        try {
            context.thread.join(joinTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        context.dispatcher.clear();
        if (context.thread.isAlive()) {
            logger.warn("Capture thread for {} did not stop within {} ms, grabber is released when it exits",
                    url, joinTimeoutMs);
        } else {
            context.releaseOnce();
        }
        logger.info("Capture stopped for {} ({} frames still held by the pipeline)", url, outstandingFrames.get());
    }

    private static void releaseGrabber(FFmpegFrameGrabber target) {
        if (target == null) {
            return;
        }
        try {
            target.stop();
            logger.debug("Grabber stopped successfully");
        } catch (Exception e) {
            logger.warn("Error stopping grabber: {}", e.getMessage());
        }
        try {
            target.release();
            logger.debug("Grabber released successfully");
        } catch (Exception e) {
            logger.error("Error releasing grabber: {}", e.getMessage(), e);
        }
    }

    /**
     * False once the grab loop has ended, also when it ended on its own.
     */
    @Override
    public synchronized boolean isRunning() {
        return session != null && session.thread.isAlive();
    }

    @Override
    public long getDroppedFrames() {
        KeepLatestDispatcher current = dispatcher;
        return current != null ? current.getDroppedFrames() : 0;
    }

    @Override
    public String describe() {
        return "grabber:" + url;
    }

    /**
     * Resources of one capture session, shared by the grab thread and the control thread
     */
    private static final class CaptureSession {

        final FFmpegFrameGrabber grabber;
        final KeepLatestDispatcher dispatcher;
        final AtomicBoolean released = new AtomicBoolean();
        volatile boolean shouldStop;
        Thread thread;

        CaptureSession(FFmpegFrameGrabber grabber, KeepLatestDispatcher dispatcher) {
            this.grabber = grabber;
            this.dispatcher = dispatcher;
        }

        void releaseOnce() {
            if (released.compareAndSet(false, true)) {
                releaseGrabber(grabber);
            }
        }
    }
}
