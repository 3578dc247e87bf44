package com.edgeviewer.edgeviewer.service.camera;

import java.util.concurrent.Executor;

/**
 * Produces camera frames and delivers them one at a time on the given executor,
 * keeping only the newest frame while the listener is busy.
 */
public interface CaptureSource {

    /**
     * Opens the input and begins delivery.
     *
     * @throws CaptureException if the input cannot be opened
     */
    void start(SensorFrameListener listener, Executor analysisExecutor) throws CaptureException;

    /**
     * Stops delivery and releases any frame still waiting for the listener.
     * Safe to call when not started.
     */
    void stop();

    boolean isRunning();

    /**
     * Frames replaced by a newer one before the listener picked them up.
     */
    long getDroppedFrames();

    String describe();
}
